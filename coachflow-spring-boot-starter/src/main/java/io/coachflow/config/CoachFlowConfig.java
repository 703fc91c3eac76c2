package io.coachflow.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.coachflow.JobHandler;
import io.coachflow.JobQueue;
import io.coachflow.TimerService;
import io.coachflow.core.JobHandlerRegistry;
import io.coachflow.flow.InterventionFlow;
import io.coachflow.flow.InterventionFlowRecoverer;
import io.coachflow.flow.InterventionStartHandler;
import io.coachflow.flow.InterventionTimeoutHandler;
import io.coachflow.flow.InterventionTimeouts;
import io.coachflow.internal.DefaultJobQueue;
import io.coachflow.internal.DispatcherOptions;
import io.coachflow.internal.DurableTimerService;
import io.coachflow.internal.HandlerInvoker;
import io.coachflow.internal.InMemoryTimerService;
import io.coachflow.internal.JobDispatcher;
import io.coachflow.internal.mongo.MongoFlowStateStore;
import io.coachflow.internal.mongo.MongoJobStore;
import io.coachflow.participant.ParticipantDirectory;
import io.coachflow.participant.ParticipantFlowRecoverer;
import io.coachflow.participant.ParticipantService;
import io.coachflow.recovery.FlowRecoverer;
import io.coachflow.recovery.PendingTimers;
import io.coachflow.recovery.RecoveryCoordinator;
import io.coachflow.routing.ReplyHandler;
import io.coachflow.routing.ResponseRouter;
import io.coachflow.schedule.DailyPromptDeliveryHandler;
import io.coachflow.schedule.DailyPromptHandler;
import io.coachflow.schedule.DailyPromptOptions;
import io.coachflow.schedule.DailyPromptReminderHandler;
import io.coachflow.schedule.DailyPromptReplyHandler;
import io.coachflow.schedule.DailyPromptSender;
import io.coachflow.schedule.ScheduleFlowRecoverer;
import io.coachflow.schedule.ScheduleRegistry;
import io.coachflow.schedule.ScheduleService;
import io.coachflow.spi.ContentGenerator;
import io.coachflow.spi.MessageSender;
import io.coachflow.state.StateManager;
import io.coachflow.store.FlowStateStore;
import io.coachflow.store.JobStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Spring Boot auto-configuration entrypoint for CoachFlow components.
 *
 * <p>The scheduling core (stores, dispatcher, timers, recovery) is always configured. The daily prompt
 * and intervention flows need a {@link MessageSender} and a {@link ContentGenerator} from the host
 * application and are skipped without them.
 */
@AutoConfiguration
@ConditionalOnClass({JobDispatcher.class, MongoTemplate.class})
@EnableConfigurationProperties(CoachFlowProperties.class)
@ConditionalOnProperty(prefix = "coachflow", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CoachFlowConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock coachFlowClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoJobStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(FlowStateStore.class)
    protected MongoFlowStateStore mongoFlowStateStore(MongoTemplate mongoTemplate) {
        return new MongoFlowStateStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected CoachFlowMongoIndexConfig coachFlowMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new CoachFlowMongoIndexConfig(mongoTemplate);
    }

    /**
     * Starts empty; {@link #coachFlowHandlerRegistrar} fills it once every handler bean exists, since
     * the in-memory timer service needs the registry before the flows that own the handlers.
     */
    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry() {
        return new JobHandlerRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public HandlerInvoker handlerInvoker(ObjectMapper objectMapper) {
        return new HandlerInvoker(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobQueue jobQueue(JobStore jobStore, JobHandlerRegistry registry, ObjectMapper objectMapper, Clock clock) {
        return new DefaultJobQueue(jobStore, registry, objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobDispatcher jobDispatcher(CoachFlowProperties props, JobStore jobStore, JobHandlerRegistry registry,
                                       HandlerInvoker invoker, Clock clock) {
        DispatcherOptions options = DispatcherOptions.builder()
                .processEvery(props.getProcessEvery())
                .batchSize(props.getBatchSize())
                .maxConcurrency(props.getMaxConcurrency())
                .lockLifetime(props.getLockLifetime())
                .workerId(props.getWorkerId())
                .build();
        return new JobDispatcher(jobStore, registry, invoker, options, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public TimerService timerService(CoachFlowProperties props, JobStore jobStore, JobHandlerRegistry registry,
                                     HandlerInvoker invoker, Clock clock) {
        return switch (props.getTimerMode()) {
            case DURABLE -> new DurableTimerService(jobStore, clock);
            case IN_MEMORY -> new InMemoryTimerService(registry, invoker, clock);
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public StateManager stateManager(FlowStateStore flowStateStore, Clock clock) {
        return new StateManager(flowStateStore, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public PendingTimers pendingTimers(StateManager stateManager, TimerService timerService,
                                       ObjectMapper objectMapper, Clock clock) {
        return new PendingTimers(stateManager, timerService, objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseRouter responseRouter() {
        return new ResponseRouter();
    }

    @Bean
    @ConditionalOnMissingBean
    public ParticipantDirectory participantDirectory(StateManager stateManager) {
        return new ParticipantDirectory(stateManager);
    }

    @Bean
    public ParticipantFlowRecoverer participantFlowRecoverer() {
        return new ParticipantFlowRecoverer();
    }

    @Bean
    @ConditionalOnMissingBean
    public RecoveryCoordinator recoveryCoordinator(CoachFlowProperties props,
                                                   StateManager stateManager,
                                                   TimerService timerService,
                                                   PendingTimers pendingTimers,
                                                   ResponseRouter responseRouter,
                                                   ObjectProvider<FlowRecoverer> recoverers,
                                                   Clock clock) {
        return new RecoveryCoordinator(stateManager, timerService, pendingTimers, responseRouter,
                recoverers.orderedStream().collect(Collectors.toList()), props.getRecoveryGrace(), clock);
    }

    @Bean
    public SmartInitializingSingleton coachFlowHandlerRegistrar(JobHandlerRegistry registry,
                                                                ResponseRouter responseRouter,
                                                                ObjectProvider<JobHandler<?>> jobHandlers,
                                                                ObjectProvider<ReplyHandler> replyHandlers) {
        return () -> {
            jobHandlers.orderedStream().forEach(registry::register);
            replyHandlers.orderedStream().forEach(responseRouter::registerHandler);
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public CoachFlowLifecycle coachFlowLifecycle(CoachFlowProperties props, JobDispatcher dispatcher,
                                                 RecoveryCoordinator recoveryCoordinator) {
        return new CoachFlowLifecycle(dispatcher, recoveryCoordinator, props.isRecoverOnStartup());
    }

    @Bean
    @ConditionalOnProperty(prefix = "coachflow", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton coachFlowIndexesInitializer(CoachFlowMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    /**
     * Daily prompts and the micro-health intervention. Both talk to participants, so both need the
     * host's messaging beans.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBean({MessageSender.class, ContentGenerator.class})
    static class FlowConfig {

        @Bean
        @ConditionalOnMissingBean
        public DailyPromptOptions dailyPromptOptions(CoachFlowProperties props) {
            return new DailyPromptOptions(props.getDailyPromptReminderDelay(), props.getDefaultPrepOffset());
        }

        @Bean
        @ConditionalOnMissingBean
        public ScheduleRegistry scheduleRegistry(StateManager stateManager, ObjectMapper objectMapper) {
            return new ScheduleRegistry(stateManager, objectMapper);
        }

        @Bean
        @ConditionalOnMissingBean
        public DailyPromptSender dailyPromptSender(StateManager stateManager,
                                                   ParticipantDirectory directory,
                                                   PendingTimers pendingTimers,
                                                   MessageSender messageSender,
                                                   ContentGenerator contentGenerator,
                                                   ObjectMapper objectMapper,
                                                   DailyPromptOptions options,
                                                   Clock clock) {
            return new DailyPromptSender(stateManager, directory, pendingTimers, messageSender, contentGenerator,
                    objectMapper, options, clock);
        }

        @Bean
        @ConditionalOnMissingBean
        public ScheduleService scheduleService(TimerService timerService,
                                               PendingTimers pendingTimers,
                                               ScheduleRegistry registry,
                                               DailyPromptSender sender,
                                               DailyPromptOptions options,
                                               Clock clock) {
            return new ScheduleService(timerService, pendingTimers, registry, sender, options, clock);
        }

        @Bean
        public DailyPromptHandler dailyPromptHandler(ScheduleRegistry registry, DailyPromptSender sender,
                                                     PendingTimers pendingTimers) {
            return new DailyPromptHandler(registry, sender, pendingTimers, new Random());
        }

        @Bean
        public DailyPromptDeliveryHandler dailyPromptDeliveryHandler(ScheduleRegistry registry, DailyPromptSender sender,
                                                                     PendingTimers pendingTimers) {
            return new DailyPromptDeliveryHandler(registry, sender, pendingTimers);
        }

        @Bean
        public DailyPromptReminderHandler dailyPromptReminderHandler(DailyPromptSender sender) {
            return new DailyPromptReminderHandler(sender);
        }

        @Bean
        public DailyPromptReplyHandler dailyPromptReplyHandler(ScheduleService scheduleService) {
            return new DailyPromptReplyHandler(scheduleService);
        }

        @Bean
        public ScheduleFlowRecoverer scheduleFlowRecoverer(ScheduleRegistry registry, TimerService timerService) {
            return new ScheduleFlowRecoverer(registry, timerService);
        }

        @Bean
        @ConditionalOnMissingBean
        public InterventionFlow interventionFlow(CoachFlowProperties props,
                                                 StateManager stateManager,
                                                 PendingTimers pendingTimers,
                                                 TimerService timerService,
                                                 ParticipantDirectory directory,
                                                 MessageSender messageSender,
                                                 ContentGenerator contentGenerator,
                                                 ObjectMapper objectMapper) {
            CoachFlowProperties.Timeouts t = props.getTimeouts();
            InterventionTimeouts timeouts = new InterventionTimeouts(
                    t.getCommitment(), t.getFeeling(), t.getCompletion(), t.getFollowUp());
            return new InterventionFlow(stateManager, pendingTimers, timerService, directory, messageSender,
                    contentGenerator, objectMapper, timeouts, new Random());
        }

        @Bean
        public InterventionTimeoutHandler interventionTimeoutHandler(InterventionFlow flow) {
            return new InterventionTimeoutHandler(flow);
        }

        @Bean
        public InterventionStartHandler interventionStartHandler(InterventionFlow flow) {
            return new InterventionStartHandler(flow);
        }

        @Bean
        public InterventionFlowRecoverer interventionFlowRecoverer(InterventionFlow flow, TimerService timerService) {
            return new InterventionFlowRecoverer(flow, timerService);
        }

        @Bean
        @ConditionalOnMissingBean
        public ParticipantService participantService(MessageSender messageSender,
                                                     StateManager stateManager,
                                                     ParticipantDirectory directory,
                                                     ResponseRouter responseRouter,
                                                     PendingTimers pendingTimers,
                                                     ObjectProvider<FlowRecoverer> recoverers) {
            List<FlowRecoverer> all = recoverers.orderedStream().collect(Collectors.toList());
            return new ParticipantService(messageSender, stateManager, directory, responseRouter, pendingTimers, all);
        }
    }
}
