package br.edu.ifba.cadgraph.extract.feature;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.Feature;

/**
 * Timeline features without a dedicated extractor: sweeps, lofts, shells and the like.
 */
public final class FeatureExtractor extends AbstractFeatureExtractor<Feature> {

    public FeatureExtractor() {
        super(Feature.class, fusionTypes(
            "SweepFeature",
            "LoftFeature",
            "ShellFeature",
            "DraftFeature",
            "ThickenFeature",
            "CombineFeature",
            "SplitBodyFeature",
            "MirrorFeature",
            "MoveFeature",
            "CylinderFeature",
            "SphereFeature",
            "TorusFeature"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull Feature feature, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(feature);
        return new Extraction(
            featureNode(feature, id, context).build(),
            featureRelationships(feature, id, context).list());
    }
}
