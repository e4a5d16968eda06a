package uk.gegc.adaptivetest.features.session.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import uk.gegc.adaptivetest.features.pool.domain.model.Item;
import uk.gegc.adaptivetest.features.pool.domain.model.QuestionPool;
import uk.gegc.adaptivetest.features.pool.domain.repository.QuestionPoolRepository;
import uk.gegc.adaptivetest.features.pool.infra.factory.ItemHandlerFactory;
import uk.gegc.adaptivetest.features.report.application.ReportGenerator;
import uk.gegc.adaptivetest.features.report.domain.model.AdaptiveTestReport;
import uk.gegc.adaptivetest.features.session.api.dto.NextQuestion;
import uk.gegc.adaptivetest.features.session.api.dto.SubmissionResult;
import uk.gegc.adaptivetest.features.session.application.AbilityEstimator;
import uk.gegc.adaptivetest.features.session.application.AdaptiveSessionService;
import uk.gegc.adaptivetest.features.session.application.AdaptiveTestMetricsService;
import uk.gegc.adaptivetest.features.session.application.ItemSelector;
import uk.gegc.adaptivetest.features.session.application.StopDecision;
import uk.gegc.adaptivetest.features.session.application.StoppingRuleEvaluator;
import uk.gegc.adaptivetest.features.session.domain.event.AdaptiveSessionCompletedEvent;
import uk.gegc.adaptivetest.features.session.domain.model.AdaptiveSession;
import uk.gegc.adaptivetest.features.session.domain.model.ItemResponse;
import uk.gegc.adaptivetest.features.session.domain.model.SessionConfig;
import uk.gegc.adaptivetest.features.session.domain.model.SessionStatus;
import uk.gegc.adaptivetest.features.session.domain.model.StopReason;
import uk.gegc.adaptivetest.features.session.domain.repository.AdaptiveSessionRepository;
import uk.gegc.adaptivetest.shared.config.AdaptiveTestingProperties;
import uk.gegc.adaptivetest.shared.exception.InvalidSessionConfigException;
import uk.gegc.adaptivetest.shared.exception.InvalidStateTransitionException;
import uk.gegc.adaptivetest.shared.exception.ItemAlreadyAdministeredException;
import uk.gegc.adaptivetest.shared.exception.NoEligibleItemsException;
import uk.gegc.adaptivetest.shared.exception.ResourceNotFoundException;
import uk.gegc.adaptivetest.shared.exception.SessionNotCompletedException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdaptiveSessionServiceImpl implements AdaptiveSessionService {

    private final AdaptiveSessionRepository sessionRepository;
    private final QuestionPoolRepository poolRepository;
    private final ItemHandlerFactory handlerFactory;
    private final AbilityEstimator abilityEstimator;
    private final ItemSelector itemSelector;
    private final StoppingRuleEvaluator stoppingRuleEvaluator;
    private final ReportGenerator reportGenerator;
    private final AdaptiveTestMetricsService metricsService;
    private final ApplicationEventPublisher eventPublisher;
    private final AdaptiveTestingProperties properties;
    private final Clock clock;

    @Override
    public UUID startSession(UUID poolId, String examineeId, SessionConfig config) {
        if (examineeId == null || examineeId.isBlank()) {
            throw new IllegalArgumentException("examineeId is required");
        }
        QuestionPool pool = loadPool(poolId);
        SessionConfig effective = config == null ? defaultConfig() : config;
        validateConfig(effective);

        Optional<AdaptiveSession> existing = sessionRepository.findInProgress(poolId, examineeId);
        if (existing.isPresent()) {
            log.info("Resuming session {} for examinee {} on pool {}", existing.get().id(), examineeId, poolId);
            return existing.get().id();
        }

        AdaptiveSession session = AdaptiveSession.create(UUID.randomUUID(), poolId, examineeId, effective)
                .start(Instant.now(clock));
        sessionRepository.save(session);
        pool.registerSession();
        metricsService.incrementSessionStarted(session.id(), poolId);
        log.info("Started session {} for examinee {} on pool {} (maxQuestions={}, seThreshold={}, method={})",
                session.id(), examineeId, poolId, effective.maxQuestions(), effective.seThreshold(),
                effective.selectionMethod());
        return session.id();
    }

    @Override
    public Item nextItem(UUID sessionId) {
        AdaptiveSession session = requireInProgress(getSession(sessionId));
        QuestionPool pool = loadPool(session.poolId());
        if (session.pendingItemId() != null) {
            return pool.getItem(session.pendingItemId());
        }

        Item item = itemSelector.selectNext(session, pool)
                .orElseThrow(() -> new NoEligibleItemsException(sessionId));
        // the shared exposure counter only moves once the issued item is stored
        sessionRepository.save(session.withPendingItem(item.id()));
        itemSelector.recordExposure(session, pool, item);
        metricsService.incrementItemExposed(pool.getId(), item.id());
        return item;
    }

    @Override
    public NextQuestion getNextQuestion(UUID sessionId) {
        AdaptiveSession session = getSession(sessionId);
        if (session.status() == SessionStatus.COMPLETED) {
            return NextQuestion.stopSignal(sessionId, session.stopReason(), session.questionsAnswered());
        }
        requireInProgress(session);
        int questionNumber = session.questionsAnswered() + 1;
        if (session.pendingItemId() != null) {
            return NextQuestion.question(sessionId, nextItem(sessionId), questionNumber);
        }

        QuestionPool pool = loadPool(session.poolId());
        StopDecision decision = stoppingRuleEvaluator.evaluate(session, Instant.now(clock),
                () -> itemSelector.hasCandidates(session, pool));
        if (decision.stop()) {
            AdaptiveSession completed = session.complete(decision.reason(), Instant.now(clock));
            AdaptiveTestReport report = reportGenerator.generate(completed, pool);
            storeCompletion(completed, report);
            return NextQuestion.stopSignal(sessionId, decision.reason(), session.questionsAnswered());
        }
        return NextQuestion.question(sessionId, nextItem(sessionId), questionNumber);
    }

    @Override
    public SubmissionResult submitResponse(UUID sessionId, String itemId, JsonNode answer, Double responseTimeSeconds) {
        AdaptiveSession session = requireInProgress(getSession(sessionId));
        if (itemId == null) {
            throw new IllegalArgumentException("itemId is required");
        }
        if (responseTimeSeconds != null && (!Double.isFinite(responseTimeSeconds) || responseTimeSeconds < 0)) {
            throw new IllegalArgumentException("responseTimeSeconds must be a non-negative number");
        }
        if (session.isAdministered(itemId)) {
            throw new ItemAlreadyAdministeredException(sessionId, itemId);
        }
        if (!itemId.equals(session.pendingItemId())) {
            throw new InvalidStateTransitionException(sessionId,
                    "Item " + itemId + " is not the item currently issued to session " + sessionId);
        }
        QuestionPool pool = loadPool(session.poolId());
        Item item = pool.getItem(itemId);
        Instant now = Instant.now(clock);

        boolean correct = handlerFactory.getHandler(item.type()).score(item, answer);

        List<AbilityEstimator.ScoredItem> history = new ArrayList<>();
        session.responses().forEach(r -> history.add(new AbilityEstimator.ScoredItem(pool.getItem(r.itemId()), r.correct())));
        history.add(new AbilityEstimator.ScoredItem(item, correct));
        AbilityEstimator.Estimate estimate = metricsService.recordEstimation(
                () -> abilityEstimator.estimate(session.theta(), history));

        ItemResponse response = new ItemResponse(itemId, session.questionsAnswered() + 1, item.topicKey(),
                item.difficulty(), answer, correct, responseTimeSeconds, session.theta(),
                estimate.theta(), estimate.standardError(), now);
        AdaptiveSession updated = session.withResponse(response);

        StopDecision decision = stoppingRuleEvaluator.evaluate(updated, now,
                () -> itemSelector.hasCandidates(updated, pool));
        AdaptiveSession result = decision.stop() ? updated.complete(decision.reason(), now) : updated;
        AdaptiveTestReport report = decision.stop() ? reportGenerator.generate(result, pool) : null;

        // nothing above writes; persist only once every step succeeded
        if (report != null) {
            storeCompletion(result, report);
        } else {
            sessionRepository.save(result);
        }
        sessionRepository.appendResponse(sessionId, response);
        pool.recordUsage(itemId, correct, responseTimeSeconds);
        metricsService.incrementResponseRecorded(sessionId, correct);

        log.debug("Session {} response #{} on item {}: correct={}, theta {} -> {}, se={}",
                sessionId, response.sequenceNumber(), itemId, correct, response.thetaBefore(),
                estimate.theta(), estimate.standardError());

        return new SubmissionResult(correct, result.theta(), result.standardError(), result.status(),
                result.stopReason(), result.questionsAnswered());
    }

    @Override
    public AdaptiveTestReport completeSession(UUID sessionId) {
        AdaptiveSession session = getSession(sessionId);
        QuestionPool pool = loadPool(session.poolId());
        if (session.status() == SessionStatus.COMPLETED) {
            return sessionRepository.findReport(sessionId)
                    .orElseGet(() -> reportGenerator.generate(session, pool));
        }
        requireInProgress(session);

        Instant now = Instant.now(clock);
        StopDecision decision = stoppingRuleEvaluator.evaluate(session, now,
                () -> itemSelector.hasCandidates(session, pool));
        StopReason reason = decision.stop() ? decision.reason() : StopReason.COMPLETED_BY_CALLER;
        AdaptiveSession completed = session.complete(reason, now);
        AdaptiveTestReport report = reportGenerator.generate(completed, pool);
        storeCompletion(completed, report);
        return report;
    }

    @Override
    public AdaptiveSession abandonSession(UUID sessionId) {
        AdaptiveSession session = getSession(sessionId);
        AdaptiveSession abandoned = sessionRepository.save(session.abandon(Instant.now(clock)));
        metricsService.incrementSessionAbandoned(sessionId, abandoned.questionsAnswered());
        log.info("Session {} abandoned after {} responses (theta={}, se={})",
                sessionId, abandoned.questionsAnswered(), abandoned.theta(), abandoned.standardError());
        return abandoned;
    }

    @Override
    public AdaptiveSession getSession(UUID sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session " + sessionId + " not found"));
    }

    @Override
    public AdaptiveTestReport getReport(UUID sessionId) {
        AdaptiveSession session = getSession(sessionId);
        if (session.status() != SessionStatus.COMPLETED) {
            throw new SessionNotCompletedException(sessionId);
        }
        return sessionRepository.findReport(sessionId)
                .orElseGet(() -> reportGenerator.generate(session, loadPool(session.poolId())));
    }

    @Override
    public SessionConfig defaultConfig() {
        AdaptiveTestingProperties.SessionDefaults defaults = properties.getSessionDefaults();
        return SessionConfig.builder()
                .maxQuestions(defaults.getMaxQuestions())
                .minQuestions(defaults.getMinQuestions())
                .seThreshold(defaults.getSeThreshold())
                .initialAbility(defaults.getInitialAbility())
                .topicBalancing(defaults.isTopicBalancing())
                .exposureControl(defaults.isExposureControl())
                .selectionMethod(defaults.getSelectionMethod())
                .maxTime(defaults.getMaxTime())
                .build();
    }

    private void storeCompletion(AdaptiveSession completed, AdaptiveTestReport report) {
        sessionRepository.save(completed);
        sessionRepository.saveReport(report);
        metricsService.incrementSessionCompleted(completed.id(), completed.stopReason(), completed.questionsAnswered());
        log.info("Session {} completed: reason={}, questions={}, theta={}, se={}",
                completed.id(), completed.stopReason().getCode(), completed.questionsAnswered(),
                completed.theta(), completed.standardError());
        eventPublisher.publishEvent(new AdaptiveSessionCompletedEvent(this, completed.id(), completed.poolId(),
                completed.examineeId(), completed.theta(), completed.standardError(),
                completed.stopReason(), completed.endedAt()));
    }

    private AdaptiveSession requireInProgress(AdaptiveSession session) {
        if (session.status() != SessionStatus.IN_PROGRESS) {
            throw new InvalidStateTransitionException(session.id(),
                    "Session " + session.id() + " is " + session.status() + ", expected IN_PROGRESS");
        }
        return session;
    }

    private QuestionPool loadPool(UUID poolId) {
        return poolRepository.findById(poolId)
                .orElseThrow(() -> new ResourceNotFoundException("Question pool " + poolId + " not found"));
    }

    private void validateConfig(SessionConfig config) {
        AdaptiveTestingProperties.Estimation bounds = properties.getEstimation();
        if (config.maxQuestions() < 1) {
            throw new InvalidSessionConfigException("maxQuestions must be at least 1, was " + config.maxQuestions());
        }
        if (config.minQuestions() < 0 || config.minQuestions() > config.maxQuestions()) {
            throw new InvalidSessionConfigException("minQuestions must be between 0 and maxQuestions, was "
                    + config.minQuestions());
        }
        if (!(config.seThreshold() > 0) || Double.isInfinite(config.seThreshold())) {
            throw new InvalidSessionConfigException("seThreshold must be a positive number, was " + config.seThreshold());
        }
        if (!(config.initialAbility() >= bounds.getMinTheta() && config.initialAbility() <= bounds.getMaxTheta())) {
            throw new InvalidSessionConfigException("initialAbility must be within [" + bounds.getMinTheta()
                    + ", " + bounds.getMaxTheta() + "], was " + config.initialAbility());
        }
        Duration maxTime = config.maxTime();
        if (maxTime != null && (maxTime.isZero() || maxTime.isNegative())) {
            throw new InvalidSessionConfigException("maxTime must be positive, was " + maxTime);
        }
        for (Map.Entry<String, Double> target : config.topicTargets().entrySet()) {
            Double weight = target.getValue();
            if (weight == null || !Double.isFinite(weight) || weight < 0) {
                throw new InvalidSessionConfigException("Topic target for " + target.getKey()
                        + " must be a non-negative number, was " + weight);
            }
        }
    }
}
