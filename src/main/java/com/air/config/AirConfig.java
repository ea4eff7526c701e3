package com.air.config;

import com.air.core.metrics.AirMetrics;
import com.air.core.queue.ReviewQueue;
import com.air.core.queue.SnapshotHandoffQueue;
import com.air.core.store.AtomicFiles;
import com.air.core.store.ReviewStore;
import com.air.pipeline.FatalErrorHandler;
import com.air.pipeline.PipelineWorkers;
import com.air.reviewer.CommandLineReviewer;
import com.air.reviewer.ReviewerInvoker;
import com.air.reviewer.StreamJsonConverter;
import com.air.series.PatchworkSeriesSource;
import com.air.series.SeriesSource;
import com.air.worktree.CopyOnWriteSnapshotter;
import com.air.worktree.GitRunner;
import com.air.worktree.ReflinkMode;
import com.air.worktree.RemoteResolver;
import com.air.worktree.Snapshotter;
import com.air.worktree.TreePreparer;
import com.air.worktree.WorkTreePool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Wires the pipeline from {@link AirProperties}.
 */
@Configuration
public class AirConfig {

    private static final Duration WORKER_POLL_INTERVAL = Duration.ofSeconds(1);

    /** Mapper for the queue, store and Patchwork documents. */
    @Bean
    public ObjectMapper storageObjectMapper() {
        return AtomicFiles.newMapper();
    }

    @Bean
    public ReviewQueue reviewQueue(AirProperties properties, ObjectMapper storageObjectMapper) {
        return new ReviewQueue(Path.of(properties.getResultsPath()).resolve("queue.json"), storageObjectMapper);
    }

    @Bean
    public ReviewStore reviewStore(AirProperties properties, ObjectMapper storageObjectMapper) {
        return new ReviewStore(Path.of(properties.getResultsPath()), storageObjectMapper);
    }

    @Bean
    public SnapshotHandoffQueue snapshotHandoffQueue(AirProperties properties) {
        return new SnapshotHandoffQueue(properties.getHandoffCapacity());
    }

    @Bean
    public GitRunner gitRunner(AirProperties properties) {
        return new GitRunner(Duration.ofSeconds(properties.getGit().getTimeoutSeconds()));
    }

    @Bean
    @ConditionalOnExpression("!'${air.patchwork.url:}'.isBlank()")
    public SeriesSource patchworkSeriesSource(AirProperties properties, ObjectMapper storageObjectMapper) {
        return new PatchworkSeriesSource(properties.getPatchwork().getUrl(), storageObjectMapper);
    }

    @Bean
    public TreePreparer treePreparer(GitRunner gitRunner, AirProperties properties,
                                     @Autowired(required = false) SeriesSource seriesSource) {
        var remotes = new RemoteResolver(properties.getRemote().getUrlTemplate(), properties.getRemote().getUrls());
        return new TreePreparer(gitRunner, remotes, seriesSource, properties.getIndex().getCommand(),
                Duration.ofSeconds(properties.getIndex().getTimeoutSeconds()));
    }

    @Bean
    public Snapshotter snapshotter(GitRunner gitRunner, AirProperties properties) {
        var mode = ReflinkMode.valueOf(properties.getSnapshot().getReflink().trim().toUpperCase(Locale.ROOT));
        return new CopyOnWriteSnapshotter(gitRunner, Path.of(properties.getWorktreeDir()).resolve("snapshots"),
                mode, properties.getSnapshot().isKeep());
    }

    @Bean
    public WorkTreePool workTreePool(AirProperties properties, GitRunner gitRunner, TreePreparer treePreparer,
                                     Snapshotter snapshotter) {
        return new WorkTreePool(Path.of(properties.getGitTree()), Path.of(properties.getWorktreeDir()),
                properties.getSetupConcurrency(), gitRunner, treePreparer, snapshotter);
    }

    @Bean
    public ReviewerInvoker reviewerInvoker(AirProperties properties, ObjectMapper storageObjectMapper) {
        var reviewer = properties.getReviewer();
        Path promptDir = reviewer.getPromptDir() == null || reviewer.getPromptDir().isBlank()
                ? null : Path.of(reviewer.getPromptDir());
        return new CommandLineReviewer(reviewer.getCommand(), reviewer.getModel(), promptDir,
                reviewer.getPromptFile(), Duration.ofSeconds(reviewer.getTimeoutSeconds()),
                new StreamJsonConverter(storageObjectMapper));
    }

    @Bean
    public FatalErrorHandler fatalErrorHandler(ApplicationContext context) {
        return new ExitingFatalErrorHandler(context);
    }

    @Bean(destroyMethod = "shutdown")
    public PipelineWorkers pipelineWorkers(WorkTreePool workTreePool, ReviewQueue reviewQueue,
                                           ReviewStore reviewStore, SnapshotHandoffQueue snapshotHandoffQueue,
                                           ReviewerInvoker reviewerInvoker, AirProperties properties,
                                           AirMetrics metrics, FatalErrorHandler fatalErrorHandler) {
        return new PipelineWorkers(workTreePool, reviewQueue, reviewStore, snapshotHandoffQueue, reviewerInvoker,
                properties.getReviewerConcurrency(), properties.getReviewerMaxAttempts(), metrics,
                fatalErrorHandler, WORKER_POLL_INTERVAL);
    }
}
