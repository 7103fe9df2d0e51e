package br.edu.ifba.cadgraph.extract.feature;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.BoxFeature;

public final class BoxFeatureExtractor extends AbstractFeatureExtractor<BoxFeature> {

    public BoxFeatureExtractor() {
        super(BoxFeature.class, fusionTypes("BoxFeature"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull BoxFeature box, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(box);
        GraphNode node = featureNode(box, id, context)
            .property("length", box.length())
            .property("width", box.width())
            .property("height", box.height())
            .build();
        return new Extraction(node, featureRelationships(box, id, context).list());
    }
}
