package br.edu.ifba.cadgraph.extract.sketch;

import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.AbstractEntityExtractor;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.extract.RelationshipCollector;
import br.edu.ifba.cadgraph.host.Profile;
import br.edu.ifba.cadgraph.host.ProfileLoop;
import br.edu.ifba.cadgraph.host.SketchCurve;

/**
 * Closed sketch regions. Boundary curves are numbered across all loops so the
 * outer loop keeps indices 0..n-1 when it comes first.
 */
public final class ProfileExtractor extends AbstractEntityExtractor<Profile> {

    public ProfileExtractor() {
        super(Profile.class, NodeCategory.PROFILE, fusionTypes("Profile"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull Profile profile, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(profile);
        List<ProfileLoop> loops = profile.loops();
        GraphNode node = node(profile, id)
            .property("area", profile.area())
            .property("loop_count", loops.size())
            .build();

        RelationshipCollector relationships = context.relationships()
            .to(id, profile.parentSketch(), RelationshipType.REFERENCES);
        int sequence = 0;
        for (int loopIndex = 0; loopIndex < loops.size(); loopIndex++) {
            ProfileLoop loop = loops.get(loopIndex);
            for (SketchCurve curve : loop.curves()) {
                relationships.to(id, curve, RelationshipType.BOUNDED_BY, Map.of(
                    "sequence_index", sequence++,
                    "loop_index", loopIndex,
                    "is_outer", loop.isOuter()));
            }
        }
        return new Extraction(node, relationships.list());
    }
}
