package br.edu.ifba.cadgraph.pipeline;

import org.jboss.logging.Logger;

import br.edu.ifba.cadgraph.storage.GraphStore;
import br.edu.ifba.cadgraph.utils.RetryEventLogger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

/**
 * CDI producer wiring the pipeline from {@link CadGraphConfig} and the active
 * {@link GraphStore} backend.
 */
@ApplicationScoped
public class CadGraphPipelineProducer {

    private static final Logger LOG = Logger.getLogger(CadGraphPipelineProducer.class);

    @Inject
    CadGraphConfig config;

    @Inject
    GraphStore graphStore;

    @Inject
    RetryEventLogger retryEventLogger;

    @Produces
    @ApplicationScoped
    public CadGraphPipeline producePipeline() {
        PipelineSettings settings = PipelineSettings.from(config);
        LOG.infof("Creating CadGraphPipeline: batch=%d, attempts=%d, transform=%s",
            settings.maxRecordsPerBatch(), settings.maxAttempts(), settings.transform());
        return new CadGraphPipeline(graphStore, settings, retryEventLogger);
    }
}
