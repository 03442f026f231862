package io.github.hide212131.langchain4j.atelier.runtime.session;

import io.github.hide212131.langchain4j.atelier.infra.config.RuntimeConfig;
import io.github.hide212131.langchain4j.atelier.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.atelier.infra.observability.SessionTracer;
import io.github.hide212131.langchain4j.atelier.runtime.evaluation.ContentExtractor;
import io.github.hide212131.langchain4j.atelier.runtime.evaluation.EvaluationParseResult;
import io.github.hide212131.langchain4j.atelier.runtime.evaluation.EvaluationParser;
import io.github.hide212131.langchain4j.atelier.runtime.model.AgentConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.Evaluation;
import io.github.hide212131.langchain4j.atelier.runtime.model.ExchangeTurn;
import io.github.hide212131.langchain4j.atelier.runtime.model.Phase;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionStatus;
import io.github.hide212131.langchain4j.atelier.runtime.model.TerminationCondition;
import io.github.hide212131.langchain4j.atelier.runtime.persistence.CreditLedger;
import io.github.hide212131.langchain4j.atelier.runtime.persistence.InsufficientCreditsException;
import io.github.hide212131.langchain4j.atelier.runtime.persistence.SessionRepository;
import io.github.hide212131.langchain4j.atelier.runtime.prompt.AgentPrompt;
import io.github.hide212131.langchain4j.atelier.runtime.prompt.PromptComposer;
import io.github.hide212131.langchain4j.atelier.runtime.provider.GenerationRequest;
import io.github.hide212131.langchain4j.atelier.runtime.provider.ProviderException;
import io.github.hide212131.langchain4j.atelier.runtime.provider.ProviderGateway;
import io.github.hide212131.langchain4j.atelier.runtime.provider.ProviderRegistry;
import io.github.hide212131.langchain4j.atelier.runtime.provider.StreamingResult;
import io.github.hide212131.langchain4j.atelier.runtime.session.event.AgentCompletePayload;
import io.github.hide212131.langchain4j.atelier.runtime.session.event.AgentStartPayload;
import io.github.hide212131.langchain4j.atelier.runtime.session.event.AgentTokenPayload;
import io.github.hide212131.langchain4j.atelier.runtime.session.event.CreditWarningPayload;
import io.github.hide212131.langchain4j.atelier.runtime.session.event.ErrorPayload;
import io.github.hide212131.langchain4j.atelier.runtime.session.event.RoundCompletePayload;
import io.github.hide212131.langchain4j.atelier.runtime.session.event.RoundStartPayload;
import io.github.hide212131.langchain4j.atelier.runtime.session.event.SessionCompletePayload;
import io.github.hide212131.langchain4j.atelier.runtime.session.event.SessionEvent;
import io.github.hide212131.langchain4j.atelier.runtime.session.event.SessionEventPayload;
import io.github.hide212131.langchain4j.atelier.runtime.session.event.SessionEventPublisher;
import io.github.hide212131.langchain4j.atelier.runtime.session.event.SessionPausedPayload;
import io.github.hide212131.langchain4j.atelier.runtime.session.event.SessionResumedPayload;
import io.github.hide212131.langchain4j.atelier.runtime.session.event.SessionStartPayload;
import io.github.hide212131.langchain4j.atelier.runtime.usage.UsageMeter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Drives a session through rounds of Writer, Editors and Synthesizer until a termination condition holds,
 * then runs one final Writer pass.
 *
 * <p>All state changes and event publication happen on the calling thread. Editors of a round run on a
 * short-lived pool; their streamed chunks travel through a queue that the calling thread drains, and their
 * turns are numbered and appended in completion order.</p>
 */
public final class RoundScheduler {

    static final String LOW_CREDIT_MESSAGE = "Low credits - session may stop soon";
    static final String NO_ACTIVE_AGENTS = "No active agents configured";

    private static final WorkflowLogger LOGGER = new WorkflowLogger(RoundScheduler.class);

    private final ProviderRegistry providers;
    private final PromptComposer promptComposer;
    private final EvaluationParser evaluationParser;
    private final ContentExtractor contentExtractor;
    private final SessionRepository repository;
    private final CreditLedger ledger;
    private final RuntimeConfig runtimeConfig;
    private final SessionTracer tracer;
    private final Clock clock;

    private RoundScheduler(Builder builder) {
        this.providers = Objects.requireNonNull(builder.providers, "providers");
        this.promptComposer = builder.promptComposer;
        this.evaluationParser = builder.evaluationParser;
        this.contentExtractor = builder.contentExtractor;
        this.repository = builder.repository;
        this.ledger = builder.ledger;
        this.runtimeConfig = builder.runtimeConfig;
        this.tracer = builder.tracer;
        this.clock = builder.clock;
    }

    public static Builder builder(ProviderRegistry providers) {
        return new Builder(providers);
    }

    /**
     * Runs the session to its end. Never throws for agent or collaborator failures; those surface as
     * events, log lines and fields of the outcome.
     */
    public SessionOutcome run(SessionState state, SessionEventPublisher publisher) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(publisher, "publisher");
        if (state.status() != SessionStatus.IDLE) {
            throw new IllegalStateException("session " + state.config().sessionId() + " was already started");
        }
        SessionConfig config = state.config();
        return tracer.traceSession(
                config.sessionId(),
                config.termination().maxRounds(),
                config.flowType().id(),
                config.activeAgents().size(),
                () -> new SessionRun(state, publisher).execute());
    }

    /** Per-session working set. Lives on the calling thread only. */
    private final class SessionRun {

        private final SessionState state;
        private final SessionConfig config;
        private final SessionEventPublisher publisher;
        private final List<AgentConfig> writers;
        private final List<AgentConfig> editors;
        private final List<AgentConfig> synthesizers;
        private Integer budget;
        private boolean creditWarningSent;

        SessionRun(SessionState state, SessionEventPublisher publisher) {
            this.state = state;
            this.config = state.config();
            this.publisher = publisher;
            this.writers = config.activeAgents(Phase.WRITER);
            this.editors = config.activeAgents(Phase.EDITOR);
            this.synthesizers = config.activeAgents(Phase.SYNTHESIZER);
        }

        SessionOutcome execute() {
            List<AgentConfig> active = new ArrayList<>(writers);
            active.addAll(editors);
            active.addAll(synthesizers);
            if (active.isEmpty()) {
                LOGGER.warn("Session {} has no active agents", config.sessionId());
                publish(new ErrorPayload(null, NO_ACTIVE_AGENTS, null));
                state.finish(SessionStatus.FAILED, NO_ACTIVE_AGENTS);
                return outcome(null, 0);
            }
            budget = resolveBudget();
            state.markStatus(SessionStatus.RUNNING);
            persist("create session", () -> repository.createSession(config));
            persist("update status", () -> repository.updateStatus(config.sessionId(), SessionStatus.RUNNING, null));
            TerminationCondition termination = config.termination();
            if (termination.threshold().isPresent() && synthesizers.isEmpty()) {
                LOGGER.warn(
                        "Session {} sets score threshold {} without an active Synthesizer; only the round limit can end it",
                        config.sessionId(),
                        termination.scoreThreshold());
            }
            LOGGER.info(
                    "Session {} started: agents={}, maxRounds={}, threshold={}, flow={}, budget={}",
                    config.sessionId(),
                    active.size(),
                    termination.maxRounds(),
                    termination.scoreThreshold(),
                    config.flowType().id(),
                    budget == null ? "unlimited" : budget);
            publish(new SessionStartPayload(
                    active.size(),
                    active.stream()
                            .map(agent -> new SessionStartPayload.AgentSummary(
                                    agent.agentId(), agent.displayName(), agent.phase().number()))
                            .toList(),
                    termination.maxRounds(),
                    termination.scoreThreshold(),
                    config.flowType().id()));

            try {
                runRounds();
            } catch (SessionAbortedException e) {
                complete(e.status(), e.stateReason(), e.eventReason(), e.eventMessage());
            } catch (RuntimeException e) {
                LOGGER.error("Session {} failed: {}", config.sessionId(), e.getMessage(), e);
                String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                publish(new ErrorPayload(null, message, null));
                complete(SessionStatus.FAILED, "Session failed: " + message, "Session failed: " + message, null);
            }
            return settle();
        }

        private void runRounds() {
            while (true) {
                checkCancelled();
                int round = state.startNextRound();
                persist("update round", () -> repository.updateRound(config.sessionId(), round));
                LOGGER.info("Session {} round {}/{} started", config.sessionId(), round, config.termination().maxRounds());
                publish(new RoundStartPayload(round, config.termination().maxRounds(), null));

                int turnsBefore = state.turnCount();
                tracer.traceRound(config.sessionId(), round, () -> runRound(round));
                publish(new RoundCompletePayload(round, state.turnCount() - turnsBefore));

                checkCancelled();
                Optional<String> termination = checkTermination();
                if (termination.isPresent()) {
                    runFinalWriterPass(round);
                    complete(SessionStatus.COMPLETED, termination.get(), termination.get(), null);
                    return;
                }
            }
        }

        private void runRound(int round) {
            for (AgentConfig writer : writers) {
                guard(1);
                AgentPrompt prompt = writerPrompt(writer, round);
                invokeSequential(writer, prompt, round, false);
                pauseCheckpoint(writer.displayName(), round);
            }

            if (!editors.isEmpty()) {
                List<List<AgentConfig>> batches = new ArrayList<>();
                switch (config.flowType()) {
                    case SEQUENTIAL -> editors.forEach(editor -> batches.add(List.of(editor)));
                    case PARALLEL_CRITIQUE -> batches.add(editors);
                }
                for (List<AgentConfig> batch : batches) {
                    guard(batch.size());
                    runEditorBatch(batch, round);
                    checkCancelled();
                    pauseCheckpoint(batch.stream().map(AgentConfig::displayName).reduce((a, b) -> a + ", " + b)
                            .orElse(Phase.EDITOR.label()), round);
                }
            }

            for (AgentConfig synthesizer : synthesizers) {
                guard(1);
                AgentPrompt prompt = promptComposer.synthesizer(
                        config, synthesizer, state.workingDocument(), editorFeedback(round));
                invokeSequential(synthesizer, prompt, round, false);
                pauseCheckpoint(synthesizer.displayName(), round);
            }
        }

        private AgentPrompt writerPrompt(AgentConfig writer, int round) {
            boolean hasWritten = state.history().stream().anyMatch(turn -> turn.phase() == Phase.WRITER);
            if (!hasWritten) {
                return promptComposer.writerFirstTurn(config, writer);
            }
            return promptComposer.writerRevision(
                    config, writer, state.workingDocument(), directiveFor(round - 1), false);
        }

        private void runFinalWriterPass(int round) {
            Optional<AgentConfig> writer = config.firstActive(Phase.WRITER);
            if (writer.isEmpty()) {
                return;
            }
            if (state.isCancelled()) {
                LOGGER.info("Session {} skips the final Writer pass: cancelled", config.sessionId());
                return;
            }
            if (remainingCredits().filter(remaining -> remaining < runtimeConfig.minCreditsPerAgent()).isPresent()) {
                LOGGER.warn(
                        "Session {} skips the final Writer pass: {} credits left",
                        config.sessionId(),
                        remainingCredits().orElse(0));
                return;
            }
            publish(new RoundStartPayload(round, config.termination().maxRounds(), Boolean.TRUE));
            AgentPrompt prompt = promptComposer.writerRevision(
                    config, writer.get(), state.workingDocument(), directiveFor(round), true);
            invokeSequential(writer.get(), prompt, round, true);
        }

        /** Synthesizer directive of the round, or the round's editor feedback when no Synthesizer spoke. */
        private String directiveFor(int round) {
            List<ExchangeTurn> history = state.history();
            for (int i = history.size() - 1; i >= 0; i--) {
                ExchangeTurn turn = history.get(i);
                if (turn.roundNumber() == round && turn.phase() == Phase.SYNTHESIZER) {
                    return turn.outputText();
                }
            }
            return editorFeedback(round);
        }

        private String editorFeedback(int round) {
            Map<String, String> feedback = new LinkedHashMap<>();
            for (ExchangeTurn turn : state.history()) {
                if (turn.roundNumber() == round && turn.phase() == Phase.EDITOR) {
                    feedback.put(turn.agentName(), turn.outputText());
                }
            }
            return PromptComposer.aggregateFeedback(feedback);
        }

        private void invokeSequential(AgentConfig agent, AgentPrompt prompt, int round, boolean finalPass) {
            Optional<ProviderGateway> gateway = gatewayFor(agent);
            if (gateway.isEmpty()) {
                return;
            }
            int turnNumber = state.turnCount() + 1;
            publish(new AgentStartPayload(
                    agent.agentId(),
                    agent.displayName(),
                    turnNumber,
                    round,
                    agent.phase().number(),
                    finalPass ? Boolean.TRUE : null));
            TurnDraft draft;
            try {
                draft = callAgent(agent, gateway.get(), prompt, chunk -> publish(new AgentTokenPayload(agent.agentId(), chunk)));
            } catch (RuntimeException e) {
                reportAgentFailure(agent, e);
                return;
            }
            record(draft, turnNumber, round, finalPass);
        }

        /**
         * Turn numbers are reserved in configuration order before any editor starts. Completed editors are recorded
         * once the whole batch is done, in reserved order, so {@code agent_start}, {@code agent_complete} and the
         * history agree. A failed editor frees its number and the editors reserved after it move down by one.
         */
        private void runEditorBatch(List<AgentConfig> batch, int round) {
            int slot = state.turnCount() + 1;
            BlockingQueue<SessionEventPayload> queue = new LinkedBlockingQueue<>();
            Map<Future<TurnDraft>, AgentConfig> inFlight = new LinkedHashMap<>();
            Map<AgentConfig, Integer> reserved = new LinkedHashMap<>();
            Map<AgentConfig, TurnDraft> completed = new HashMap<>();
            ExecutorService executor = Executors.newFixedThreadPool(batch.size(), new EditorThreadFactory(config.sessionId()));
            CompletionService<TurnDraft> completion = new ExecutorCompletionService<>(executor);
            try {
                for (AgentConfig editor : batch) {
                    Optional<ProviderGateway> gateway = gatewayFor(editor);
                    if (gateway.isEmpty()) {
                        continue;
                    }
                    int turnNumber = slot++;
                    reserved.put(editor, turnNumber);
                    publish(new AgentStartPayload(
                            editor.agentId(), editor.displayName(), turnNumber, round, editor.phase().number(), null));
                    AgentPrompt prompt = promptComposer.editor(config, editor, state.workingDocument());
                    Future<TurnDraft> future = completion.submit(() -> callAgent(
                            editor, gateway.get(), prompt, chunk -> queue.add(new AgentTokenPayload(editor.agentId(), chunk))));
                    inFlight.put(future, editor);
                }
                int remaining = inFlight.size();
                while (remaining > 0) {
                    Future<TurnDraft> done = completion.poll(
                            runtimeConfig.queuePollInterval().toMillis(), TimeUnit.MILLISECONDS);
                    drain(queue);
                    if (done == null) {
                        continue;
                    }
                    remaining--;
                    AgentConfig editor = inFlight.get(done);
                    try {
                        completed.put(editor, done.get());
                    } catch (ExecutionException e) {
                        Throwable cause = e.getCause() == null ? e : e.getCause();
                        reportAgentFailure(editor, cause);
                    }
                }
                drain(queue);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                inFlight.keySet().forEach(future -> future.cancel(true));
                state.cancel();
                throw SessionAbortedException.cancelled();
            } finally {
                executor.shutdownNow();
            }
            reserved.forEach((editor, turnNumber) -> {
                TurnDraft draft = completed.get(editor);
                if (draft != null) {
                    record(draft, turnNumber, round, false);
                }
            });
        }

        private void drain(BlockingQueue<SessionEventPayload> queue) {
            List<SessionEventPayload> pending = new ArrayList<>();
            queue.drainTo(pending);
            pending.forEach(this::publish);
        }

        private Optional<ProviderGateway> gatewayFor(AgentConfig agent) {
            Optional<ProviderGateway> gateway = providers.find(agent.provider());
            if (gateway.isEmpty()) {
                String message = "Provider " + agent.provider().id() + " not configured";
                LOGGER.warn("Skipping {}: {}", agent.displayName(), message);
                publish(new ErrorPayload(agent.agentId(), message, null));
            }
            return gateway;
        }

        private void reportAgentFailure(AgentConfig agent, Throwable failure) {
            String fault = null;
            if (failure instanceof ProviderException providerException) {
                fault = providerException.fault().name().toLowerCase(Locale.ROOT);
                if (providerException.midStream()) {
                    LOGGER.warn(
                            "Partial output of {} discarded after a mid-stream failure; it is not billed",
                            agent.displayName());
                }
            }
            String message = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
            LOGGER.error("Error streaming from {}: {}", agent.displayName(), message);
            tracer.agentFailed(agent.agentId(), fault);
            publish(new ErrorPayload(agent.agentId(), message, fault));
        }

        private void record(TurnDraft draft, int reservedNumber, int round, boolean finalPass) {
            AgentConfig agent = draft.agent();
            int turnNumber = state.turnCount() + 1;
            if (turnNumber != reservedNumber) {
                LOGGER.info(
                        "Turn {} of {} is recorded as turn {} after an earlier editor failed",
                        reservedNumber,
                        agent.displayName(),
                        turnNumber);
            }
            String document = agent.phase().mutatesDocument() ? draft.output() : state.workingDocument();
            ExchangeTurn turn = new ExchangeTurn(
                    turnNumber,
                    round,
                    agent.phase(),
                    agent.agentId(),
                    agent.displayName(),
                    draft.output(),
                    draft.rawResponse(),
                    draft.evaluation(),
                    draft.parseError(),
                    document,
                    draft.inputTokens(),
                    draft.outputTokens(),
                    draft.creditsUsed(),
                    finalPass,
                    clock.instant());
            state.appendTurn(turn);
            persist("append turn", () -> repository.appendTurn(
                    config.sessionId(), turn, agent.phase(), turn.inputTokens(), turn.outputTokens(), turn.creditsUsed()));
            if (agent.phase().mutatesDocument()) {
                persist("update working document", () -> repository.updateWorkingDocument(config.sessionId(), document));
            }
            if (draft.parseError() != null) {
                LOGGER.debug("Turn {} ({}) has no evaluation: {}", turnNumber, agent.displayName(), draft.parseError());
            }
            LOGGER.info(
                    "Turn {} {} done: score={}, tokens={}/{}{}, credits={} (session total {})",
                    turnNumber,
                    agent.displayName(),
                    turn.optionalEvaluation().map(Evaluation::overallScore).map(String::valueOf).orElse("-"),
                    turn.inputTokens(),
                    turn.outputTokens(),
                    draft.usageEstimated() ? " (estimated)" : "",
                    turn.creditsUsed(),
                    state.creditsUsed());
            tracer.turnRecorded(
                    turnNumber,
                    agent.agentId(),
                    turn.creditsUsed(),
                    turn.optionalEvaluation().map(Evaluation::overallScore).orElse(null));
            publish(new AgentCompletePayload(
                    agent.agentId(),
                    agent.displayName(),
                    turnNumber,
                    round,
                    agent.phase().number(),
                    finalPass ? Boolean.TRUE : null,
                    AgentCompletePayload.EvaluationSummary.of(turn.evaluation()),
                    turn.outputText().length(),
                    new AgentCompletePayload.TurnUsage(
                            turn.inputTokens(), turn.outputTokens(), turn.creditsUsed(), state.creditsUsed())));
            maybeWarnLowCredits();
        }

        private void maybeWarnLowCredits() {
            if (creditWarningSent) {
                return;
            }
            Optional<Integer> remaining = remainingCredits();
            if (remaining.isPresent() && remaining.get() < runtimeConfig.lowCreditWarning()) {
                creditWarningSent = true;
                LOGGER.warn("Session {} is low on credits: {} left", config.sessionId(), remaining.get());
                publish(new CreditWarningPayload(remaining.get(), state.creditsUsed(), LOW_CREDIT_MESSAGE));
            }
        }

        private void guard(int agentCount) {
            checkCancelled();
            Optional<Integer> remaining = remainingCredits();
            int required = runtimeConfig.minCreditsPerAgent() * agentCount;
            if (remaining.isPresent() && remaining.get() < required) {
                LOGGER.warn(
                        "Session {} stops: {} credits left, {} needed for the next {} agent(s)",
                        config.sessionId(),
                        remaining.get(),
                        required,
                        agentCount);
                throw SessionAbortedException.creditDepleted();
            }
        }

        private void checkCancelled() {
            if (state.isCancelled()) {
                throw SessionAbortedException.cancelled();
            }
        }

        private void pauseCheckpoint(String afterAgent, int round) {
            if (!state.isPaused() || state.isCancelled()) {
                return;
            }
            state.markStatus(SessionStatus.PAUSED);
            persist("update status", () -> repository.updateStatus(config.sessionId(), SessionStatus.PAUSED, null));
            LOGGER.info("Session {} paused after {}", config.sessionId(), afterAgent);
            publish(new SessionPausedPayload(afterAgent, state.turnCount(), round));
            boolean resumed;
            try {
                resumed = state.awaitResume(runtimeConfig.pausePollInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                state.cancel();
                resumed = false;
            }
            if (!resumed) {
                throw SessionAbortedException.cancelled();
            }
            state.markStatus(SessionStatus.RUNNING);
            persist("update status", () -> repository.updateStatus(config.sessionId(), SessionStatus.RUNNING, null));
            LOGGER.info("Session {} resumed", config.sessionId());
            publish(new SessionResumedPayload(state.turnCount(), round));
        }

        private Optional<String> checkTermination() {
            TerminationCondition termination = config.termination();
            if (state.currentRound() >= termination.maxRounds()) {
                return Optional.of("Maximum rounds reached (" + termination.maxRounds() + ")");
            }
            if (termination.threshold().isEmpty()) {
                return Optional.empty();
            }
            double threshold = termination.scoreThreshold();
            List<ExchangeTurn> history = state.history();
            for (int i = history.size() - 1; i >= 0; i--) {
                ExchangeTurn turn = history.get(i);
                if (turn.phase() != Phase.SYNTHESIZER || turn.evaluation() == null) {
                    continue;
                }
                double score = turn.evaluation().overallScore();
                if (score >= threshold) {
                    return Optional.of(String.format(
                            Locale.ROOT,
                            "Quality target reached: %s scored %.1f (target: %s)",
                            turn.agentName(),
                            score,
                            termination.scoreThreshold()));
                }
                break;
            }
            return Optional.empty();
        }

        private void complete(SessionStatus status, String stateReason, String eventReason, String message) {
            state.finish(status, stateReason);
            persist("update status", () -> repository.updateStatus(config.sessionId(), status, stateReason));
            LOGGER.info(
                    "Session {} finished: status={}, reason={}, rounds={}, turns={}, credits={}",
                    config.sessionId(),
                    status.id(),
                    stateReason,
                    state.currentRound(),
                    state.turnCount(),
                    state.creditsUsed());
            publish(new SessionCompletePayload(
                    eventReason, message, state.currentRound(), state.turnCount(), state.creditsUsed()));
        }

        private SessionOutcome settle() {
            int total = state.creditsUsed();
            Optional<String> userId = config.optionalUserId();
            if (ledger == null || userId.isEmpty() || total <= 0) {
                return outcome(null, 0);
            }
            String description = "Session: " + config.displayTitle();
            try {
                int balance = ledger.deduct(userId.get(), total, config.sessionId(), description);
                LOGGER.info("Deducted {} credits from {}; balance now {}", total, userId.get(), balance);
                return outcome(balance, 0);
            } catch (InsufficientCreditsException e) {
                LOGGER.warn(
                        "Could not settle session {}: {} credits short ({})",
                        config.sessionId(),
                        e.shortfall(),
                        e.getMessage());
                return outcome(null, e.shortfall());
            } catch (RuntimeException e) {
                LOGGER.warn("Could not settle session {}: {}", config.sessionId(), e.getMessage());
                return outcome(null, 0);
            }
        }

        private SessionOutcome outcome(Integer remainingBalance, int shortfall) {
            return new SessionOutcome(
                    config.sessionId(),
                    state.status(),
                    state.terminationReason().orElse(null),
                    state.currentRound(),
                    state.history(),
                    state.creditsUsed(),
                    state.workingDocument(),
                    remainingBalance,
                    shortfall);
        }

        private Integer resolveBudget() {
            if (state.creditBudget().isPresent()) {
                return state.creditBudget().get();
            }
            Optional<String> userId = config.optionalUserId();
            if (ledger == null || userId.isEmpty()) {
                return null;
            }
            try {
                return ledger.getBalance(userId.get());
            } catch (RuntimeException e) {
                LOGGER.warn("Could not read the balance of {}; running without a credit limit: {}",
                        userId.get(), e.getMessage());
                return null;
            }
        }

        private Optional<Integer> remainingCredits() {
            return budget == null ? Optional.empty() : Optional.of(budget - state.creditsUsed());
        }

        private void persist(String action, Runnable call) {
            if (repository == null) {
                return;
            }
            try {
                call.run();
            } catch (RuntimeException e) {
                LOGGER.warn("Session {}: failed to {}: {}", config.sessionId(), action, e.getMessage());
            }
        }

        private void publish(SessionEventPayload payload) {
            publisher.publish(new SessionEvent(config.sessionId(), clock.instant(), payload));
        }
    }

    /** Provider call, parsing and metering of one agent turn. Safe to run off the scheduler thread. */
    private TurnDraft callAgent(AgentConfig agent, ProviderGateway gateway, AgentPrompt prompt, Consumer<String> onChunk) {
        GenerationRequest request = new GenerationRequest(
                prompt.systemPrompt(), prompt.userPrompt(), agent.model(), runtimeConfig.temperature());
        LOGGER.info("Calling {} ({} / {})", agent.displayName(), gateway.type().id(), agent.model());
        StreamingResult result = gateway.generateStreamWithUsage(request, onChunk);
        String raw = result.content() == null ? "" : result.content();
        EvaluationParseResult parsed = evaluationParser.parse(raw, agent.criterionNames());
        String output = contentExtractor.extract(raw);
        int inputTokens = result.usage().inputTokens();
        int outputTokens = result.usage().outputTokens();
        int credits = UsageMeter.creditsForTurn(agent.model(), inputTokens, outputTokens);
        return new TurnDraft(
                agent,
                raw,
                output,
                parsed.evaluation(),
                parsed.error(),
                inputTokens,
                outputTokens,
                credits,
                result.usage().estimated());
    }

    private static final class EditorThreadFactory implements ThreadFactory {

        private final String sessionId;
        private final AtomicInteger counter = new AtomicInteger();

        EditorThreadFactory(String sessionId) {
            this.sessionId = sessionId;
        }

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "atelier-editor-" + sessionId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static final class Builder {

        private final ProviderRegistry providers;
        private PromptComposer promptComposer = new PromptComposer();
        private EvaluationParser evaluationParser = new EvaluationParser();
        private ContentExtractor contentExtractor = new ContentExtractor();
        private SessionRepository repository;
        private CreditLedger ledger;
        private RuntimeConfig runtimeConfig = RuntimeConfig.defaults();
        private SessionTracer tracer = SessionTracer.noop();
        private Clock clock = Clock.systemUTC();

        private Builder(ProviderRegistry providers) {
            this.providers = providers;
        }

        public Builder promptComposer(PromptComposer promptComposer) {
            this.promptComposer = Objects.requireNonNull(promptComposer, "promptComposer");
            return this;
        }

        public Builder evaluationParser(EvaluationParser evaluationParser) {
            this.evaluationParser = Objects.requireNonNull(evaluationParser, "evaluationParser");
            return this;
        }

        public Builder contentExtractor(ContentExtractor contentExtractor) {
            this.contentExtractor = Objects.requireNonNull(contentExtractor, "contentExtractor");
            return this;
        }

        /** Optional; progress is kept in memory only when absent. */
        public Builder repository(SessionRepository repository) {
            this.repository = repository;
            return this;
        }

        /** Optional; without a ledger there is no budget lookup and no settlement. */
        public Builder ledger(CreditLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        public Builder runtimeConfig(RuntimeConfig runtimeConfig) {
            this.runtimeConfig = Objects.requireNonNull(runtimeConfig, "runtimeConfig");
            return this;
        }

        public Builder tracer(SessionTracer tracer) {
            this.tracer = Objects.requireNonNull(tracer, "tracer");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public RoundScheduler build() {
            return new RoundScheduler(this);
        }
    }
}
