package br.edu.ifba.cadgraph.extract.feature;

import java.util.Set;

import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.AbstractEntityExtractor;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.extract.RelationshipCollector;
import br.edu.ifba.cadgraph.host.Feature;

/**
 * Timeline properties and the {@code consumes}/{@code produces} edges common to all features.
 */
abstract class AbstractFeatureExtractor<T extends Feature> extends AbstractEntityExtractor<T> {

    protected AbstractFeatureExtractor(Class<T> entityType, Set<String> objectTypes) {
        super(entityType, NodeCategory.FEATURE, objectTypes);
    }

    protected GraphNode.Builder featureNode(T feature, String id, ExtractionContext context) {
        return node(feature, id)
            .property("name", feature.name())
            .property("timeline_index", feature.timelineIndex())
            .property("component_id", context.referenceIdOf(feature.parentComponent()))
            .property("is_suppressed", feature.isSuppressed())
            .property("health_state", feature.healthState());
    }

    protected RelationshipCollector featureRelationships(T feature, String id, ExtractionContext context) {
        return context.relationships()
            .all(id, feature.profiles(), RelationshipType.CONSUMES)
            .all(id, feature.bodies(), RelationshipType.PRODUCES);
    }
}
