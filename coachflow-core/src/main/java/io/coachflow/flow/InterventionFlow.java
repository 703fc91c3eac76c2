package io.coachflow.flow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.coachflow.TimerService;
import io.coachflow.core.FlowTypes;
import io.coachflow.core.ScheduleSpec;
import io.coachflow.core.TimerAction;
import io.coachflow.core.TimerHandle;
import io.coachflow.participant.ParticipantDirectory;
import io.coachflow.recovery.PendingTimers;
import io.coachflow.routing.ReplyHandler;
import io.coachflow.spi.ContentGenerator;
import io.coachflow.spi.MessageSender;
import io.coachflow.state.StateManager;
import io.coachflow.store.ParticipantFlowState;
import io.coachflow.utils.ReplyCanonicalizer;
import io.coachflow.utils.ScheduleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Daily micro-intervention state machine.
 *
 * <p>Entering a state persists it first, then arms (or drops) the state's timeout, then sends its prompt.
 * Replies and timeouts both re-read the current state and are ignored when the participant has already
 * moved on. The immediate/reflective assignment is drawn once per day and persisted before use.
 */
public class InterventionFlow implements ReplyHandler {
    private static final Logger log = LoggerFactory.getLogger(InterventionFlow.class);

    public static final String FLOW_TYPE = FlowTypes.MICRO_HEALTH_INTERVENTION;
    static final String TIMEOUT_TIMER = "stateTimeout";

    public static final String KEY_FLOW_ASSIGNMENT = "flowAssignment";
    public static final String KEY_FEELING = "feelingResponse";
    public static final String KEY_COMPLETION = "completionResponse";
    public static final String KEY_GOT_CHANCE = "gotChanceResponse";
    public static final String KEY_CONTEXT = "contextResponse";
    public static final String KEY_MOOD = "moodResponse";
    public static final String KEY_BARRIER = "barrierResponse";
    public static final String KEY_BARRIER_REASON = "barrierReasonResponse";
    static final String KEY_DAILY_START = "dailyStart";
    static final String KEY_DAILY_START_HANDLE = "dailyStartHandle";

    public static final String ASSIGNMENT_IMMEDIATE = "immediate";
    public static final String ASSIGNMENT_REFLECTIVE = "reflective";
    public static final String FEELING_TIMED_OUT = "timed_out";

    private static final List<String> DAY_KEYS = List.of(
            KEY_FLOW_ASSIGNMENT, KEY_FEELING, KEY_COMPLETION, KEY_GOT_CHANCE,
            KEY_CONTEXT, KEY_MOOD, KEY_BARRIER, KEY_BARRIER_REASON
    );

    private final StateManager stateManager;
    private final PendingTimers pendingTimers;
    private final TimerService timerService;
    private final ParticipantDirectory directory;
    private final MessageSender messageSender;
    private final ContentGenerator contentGenerator;
    private final ObjectMapper objectMapper;
    private final InterventionTimeouts timeouts;
    private final Random random;

    public InterventionFlow(StateManager stateManager,
                            PendingTimers pendingTimers,
                            TimerService timerService,
                            ParticipantDirectory directory,
                            MessageSender messageSender,
                            ContentGenerator contentGenerator,
                            ObjectMapper objectMapper,
                            InterventionTimeouts timeouts,
                            Random random) {
        this.stateManager = Objects.requireNonNull(stateManager, "stateManager must not be null");
        this.pendingTimers = Objects.requireNonNull(pendingTimers, "pendingTimers must not be null");
        this.timerService = Objects.requireNonNull(timerService, "timerService must not be null");
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.messageSender = Objects.requireNonNull(messageSender, "messageSender must not be null");
        this.contentGenerator = Objects.requireNonNull(contentGenerator, "contentGenerator must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    @Override
    public String flowType() {
        return FLOW_TYPE;
    }

    public Optional<InterventionState> currentState(String participantId) {
        return stateManager.getCurrentState(participantId, FLOW_TYPE).flatMap(InterventionState::parse);
    }

    /**
     * Begin a new day. Ignored while a day is still in progress.
     *
     * @return true if the day was started
     */
    public boolean start(String participantId) {
        Optional<InterventionState> current = currentState(participantId);
        if (current.isPresent() && current.get() != InterventionState.END_OF_DAY) {
            log.info("intervention start ignored; day in progress participantId={} state={}", participantId, current.get());
            return false;
        }
        clearDay(participantId);
        enter(participantId, InterventionState.ORIENTATION);
        return true;
    }

    @Override
    public void onReply(String participantId, String text) {
        Optional<InterventionState> current = currentState(participantId);
        if (current.isEmpty()) {
            log.info("intervention reply ignored; flow not started participantId={}", participantId);
            return;
        }
        String reply = ReplyCanonicalizer.canonicalize(text);
        InterventionState state = current.get();
        log.debug("intervention reply participantId={} state={} reply={}", participantId, state, reply);

        InterventionState next = switch (state) {
            case COMMITMENT_PROMPT -> {
                if (ReplyCanonicalizer.matches(reply, "1", "let's do it", "lets do it", "yes")) {
                    yield InterventionState.FEELING_PROMPT;
                }
                if (ReplyCanonicalizer.matches(reply, "2", "not yet", "no")) {
                    yield InterventionState.END_OF_DAY;
                }
                yield null;
            }
            case FEELING_PROMPT -> {
                if (reply.matches("[1-5]") || ReplyCanonicalizer.matches(reply, "ready")) {
                    record(participantId, KEY_FEELING, reply);
                    yield InterventionState.RANDOM_ASSIGNMENT;
                }
                yield null;
            }
            case SEND_INTERVENTION_IMMEDIATE, SEND_INTERVENTION_REFLECTIVE -> {
                if (ReplyCanonicalizer.matches(reply, "done")) {
                    record(participantId, KEY_COMPLETION, "done");
                    yield InterventionState.REINFORCEMENT_FOLLOWUP;
                }
                if (ReplyCanonicalizer.matches(reply, "no")) {
                    record(participantId, KEY_COMPLETION, "no");
                    yield InterventionState.DID_YOU_GET_A_CHANCE;
                }
                yield null;
            }
            case DID_YOU_GET_A_CHANCE -> {
                if (ReplyCanonicalizer.matches(reply, "1", "yes")) {
                    record(participantId, KEY_GOT_CHANCE, "yes");
                    yield InterventionState.CONTEXT_QUESTION;
                }
                if (ReplyCanonicalizer.matches(reply, "2", "no")) {
                    record(participantId, KEY_GOT_CHANCE, "no");
                    yield InterventionState.BARRIER_REASON_NO_CHANCE;
                }
                yield null;
            }
            case CONTEXT_QUESTION -> {
                if (reply.matches("[1-4]")) {
                    record(participantId, KEY_CONTEXT, reply);
                    yield InterventionState.MOOD_QUESTION;
                }
                yield null;
            }
            case MOOD_QUESTION -> {
                if (reply.matches("[1-3]")) {
                    record(participantId, KEY_MOOD, reply);
                    yield InterventionState.BARRIER_CHECK_AFTER_CONTEXT_MOOD;
                }
                yield null;
            }
            case BARRIER_CHECK_AFTER_CONTEXT_MOOD, BARRIER_REASON_NO_CHANCE -> {
                if (reply.isEmpty()) {
                    yield null;
                }
                record(participantId,
                        state == InterventionState.BARRIER_CHECK_AFTER_CONTEXT_MOOD ? KEY_BARRIER : KEY_BARRIER_REASON,
                        text.trim());
                yield InterventionState.END_OF_DAY;
            }
            case END_OF_DAY -> {
                if (ReplyCanonicalizer.matches(reply, "ready")) {
                    clearDay(participantId);
                    yield InterventionState.COMMITMENT_PROMPT;
                }
                yield null;
            }
            default -> null;
        };

        if (next == null) {
            if (state.awaitsReply()) {
                log.info("intervention reply not recognized participantId={} state={}", participantId, state);
                sendPrompt(participantId, state, true);
            }
            return;
        }
        enter(participantId, next);
    }

    /**
     * Apply the default transition of {@code expectedState} if the participant is still in it.
     *
     * @return true if a transition happened
     */
    public boolean onTimeout(String participantId, InterventionState expectedState) {
        Optional<InterventionState> current = currentState(participantId);
        if (current.isEmpty() || current.get() != expectedState) {
            log.info("intervention timeout ignored participantId={} expected={} current={}",
                    participantId, expectedState, current.orElse(null));
            return false;
        }
        InterventionState target = expectedState.timeoutTarget();
        if (target == null) {
            return false;
        }
        // The firing timer is this marker; drop it so entering the next state does not cancel it mid-run.
        pendingTimers.clear(participantId, FLOW_TYPE, TIMEOUT_TIMER);
        if (expectedState == InterventionState.FEELING_PROMPT) {
            record(participantId, KEY_FEELING, FEELING_TIMED_OUT);
        }
        log.info("intervention timeout participantId={} from={} to={}", participantId, expectedState, target);
        enter(participantId, target);
        return true;
    }

    /**
     * Start a new day every day at {@code hour:minute} in {@code timezone}.
     */
    public TimerHandle scheduleDailyStart(String participantId, int hour, int minute, String timezone) {
        ScheduleSpec spec = ScheduleSpec.daily(hour, minute, timezone);
        ScheduleEvaluator.validate(spec);
        cancelDailyStart(participantId);
        TimerHandle handle = armDailyStart(participantId, spec);
        try {
            stateManager.update(participantId, FLOW_TYPE, s -> s
                    .withData(KEY_DAILY_START, encode(spec))
                    .withData(KEY_DAILY_START_HANDLE, handle.value()));
        } catch (RuntimeException e) {
            log.warn("daily start armed but not recorded participantId={} handle={} msg={}", participantId, handle, e.getMessage());
        }
        return handle;
    }

    public void cancelDailyStart(String participantId) {
        stateManager.getStateData(participantId, FLOW_TYPE, KEY_DAILY_START_HANDLE)
                .map(TimerHandle::of)
                .ifPresent(timerService::cancel);
        if (stateManager.find(participantId, FLOW_TYPE).isPresent()) {
            stateManager.update(participantId, FLOW_TYPE, s -> s
                    .withoutData(KEY_DAILY_START)
                    .withoutData(KEY_DAILY_START_HANDLE));
        }
    }

    TimerHandle armDailyStart(String participantId, ScheduleSpec spec) {
        return timerService.recurring(
                spec,
                new TimerAction(InterventionStartHandler.KIND, Map.of("participantId", participantId),
                        "intervention-start:" + participantId)
        );
    }

    Optional<ScheduleSpec> dailyStart(ParticipantFlowState state) {
        String json = state.get(KEY_DAILY_START);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, ScheduleSpec.class));
        } catch (JsonProcessingException e) {
            log.warn("daily start unreadable participantId={} msg={}", state.participantId(), e.getMessage());
            return Optional.empty();
        }
    }

    private void enter(String participantId, InterventionState state) {
        stateManager.setCurrentState(participantId, FLOW_TYPE, state.name());

        if (state.awaitsReply()) {
            pendingTimers.armAfter(
                    participantId,
                    FLOW_TYPE,
                    TIMEOUT_TIMER,
                    new TimerAction(
                            InterventionTimeoutHandler.KIND,
                            Map.of("participantId", participantId, "expectedState", state.name()),
                            "intervention-timeout:" + participantId
                    ),
                    timeouts.forState(state)
            );
        } else {
            pendingTimers.disarm(participantId, FLOW_TYPE, TIMEOUT_TIMER);
        }

        if (state.sendsPrompt()) {
            sendPrompt(participantId, state, false);
        }

        switch (state) {
            case ORIENTATION -> enter(participantId, InterventionState.COMMITMENT_PROMPT);
            case RANDOM_ASSIGNMENT -> enter(participantId, ASSIGNMENT_IMMEDIATE.equals(assignment(participantId))
                    ? InterventionState.SEND_INTERVENTION_IMMEDIATE
                    : InterventionState.SEND_INTERVENTION_REFLECTIVE);
            case REINFORCEMENT_FOLLOWUP, IGNORED_PATH -> enter(participantId, InterventionState.END_OF_DAY);
            default -> {
            }
        }
    }

    // Drawn once per day and persisted before use, so a restart never re-draws.
    private String assignment(String participantId) {
        Optional<String> existing = stateManager.getStateData(participantId, FLOW_TYPE, KEY_FLOW_ASSIGNMENT);
        if (existing.isPresent()) {
            return existing.get();
        }
        String drawn = random.nextBoolean() ? ASSIGNMENT_IMMEDIATE : ASSIGNMENT_REFLECTIVE;
        record(participantId, KEY_FLOW_ASSIGNMENT, drawn);
        log.info("intervention assignment drawn participantId={} assignment={}", participantId, drawn);
        return drawn;
    }

    private void sendPrompt(String participantId, InterventionState state, boolean retry) {
        Optional<String> to = directory.addressOf(participantId);
        if (to.isEmpty()) {
            log.warn("intervention prompt not sent; participant has no address participantId={} state={}", participantId, state);
            return;
        }
        Map<String, String> context = new HashMap<>();
        context.put("kind", "intervention");
        context.put("flow", FLOW_TYPE);
        context.put("state", state.name());
        if (retry) {
            context.put("retry", "true");
        }
        stateManager.getStateData(participantId, FLOW_TYPE, KEY_FLOW_ASSIGNMENT)
                .ifPresent(a -> context.put(KEY_FLOW_ASSIGNMENT, a));

        String text = contentGenerator.generate(participantId, context);
        List<String> options = state.replyOptions();
        if (options.isEmpty()) {
            messageSender.send(to.get(), text);
        } else {
            messageSender.sendInteractive(to.get(), text, options);
        }
    }

    private void record(String participantId, String key, String value) {
        stateManager.setStateData(participantId, FLOW_TYPE, key, value);
    }

    private void clearDay(String participantId) {
        stateManager.update(participantId, FLOW_TYPE, s -> {
            ParticipantFlowState next = s;
            for (String key : DAY_KEYS) {
                next = next.withoutData(key);
            }
            return next;
        });
    }

    private String encode(ScheduleSpec spec) {
        try {
            return objectMapper.writeValueAsString(spec);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("schedule spec is not serializable", e);
        }
    }
}
