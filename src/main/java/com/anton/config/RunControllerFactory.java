package com.anton.config;

import com.anton.core.engine.RunConfigResolver;
import com.anton.core.engine.RunController;
import com.anton.core.knowledge.PlanDirectoryKnowledgeStore;
import com.anton.core.lock.LockManager;
import com.anton.core.metrics.AntonMetrics;
import com.anton.core.progress.ProgressListener;
import com.anton.core.session.AgentSessionFactory;
import com.anton.core.session.SessionDefaults;
import com.anton.core.vcs.GitSafetyNet;
import com.anton.core.verify.TaskVerifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Builds run controllers over the shared application beans. Each surface supplies its own
 * progress listener and the overrides it parsed.
 */
@Component
public class RunControllerFactory {

    private final AntonProperties properties;
    private final LockManager lockManager;
    private final AgentSessionFactory sessionFactory;
    private final SessionDefaults sessionDefaults;
    private final TaskVerifier verifier;
    private final AntonMetrics metrics;
    private final Clock clock;

    public RunControllerFactory(AntonProperties properties, LockManager lockManager,
                                AgentSessionFactory sessionFactory, SessionDefaults sessionDefaults,
                                TaskVerifier verifier, AntonMetrics metrics, Clock clock) {
        this.properties = properties;
        this.lockManager = lockManager;
        this.sessionFactory = sessionFactory;
        this.sessionDefaults = sessionDefaults;
        this.verifier = verifier;
        this.metrics = metrics;
        this.clock = clock;
    }

    public RunController create(Path projectDir, AntonProperties.RunOverrides overrides, ProgressListener listener) {
        RunConfigResolver resolver = taskFile -> properties.toRunConfig(taskFile, projectDir, overrides);
        return new RunController(resolver, lockManager, sessionFactory, sessionDefaults, verifier, metrics,
                GitSafetyNet::new,
                run -> new PlanDirectoryKnowledgeStore(run.projectDir(), run.planDir()),
                listener, clock);
    }
}
