package xyz.vvrf.reactor.workflow.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.workflow.execution.ExecutionCleanupTask;
import xyz.vvrf.reactor.workflow.execution.StandardWorkflowExecutor;
import xyz.vvrf.reactor.workflow.execution.WorkflowExecutor;
import xyz.vvrf.reactor.workflow.monitor.LoggingWorkflowMonitorListener;
import xyz.vvrf.reactor.workflow.monitor.MicrometerWorkflowMonitorListener;
import xyz.vvrf.reactor.workflow.monitor.WorkflowMonitorListener;
import xyz.vvrf.reactor.workflow.registry.InMemoryWorkflowRegistry;
import xyz.vvrf.reactor.workflow.registry.TemplateRegistry;
import xyz.vvrf.reactor.workflow.registry.WorkflowRegistry;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作流引擎的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link WorkflowEngineProperties}。
 * 2. 提供后台执行使用的 {@link Scheduler} Bean ("workflowExecutionScheduler")，类型由属性配置。
 * 3. 收集所有的 {@link WorkflowMonitorListener} Bean 到一个列表 Bean ("workflowMonitorListeners")。
 * 4. 提供 {@link WorkflowExecutor}、{@link WorkflowRegistry}、{@link TemplateRegistry} 和执行清理任务。
 * 5. 按条件注册日志监听器和 Micrometer 监听器。
 * <p>
 * 所有 Bean 都可以由用户自定义同名/同类型 Bean 覆盖。
 */
@Configuration
@EnableConfigurationProperties(WorkflowEngineProperties.class)
@AutoConfigureAfter(name = {
        "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
})
@Slf4j
public class WorkflowEngineAutoConfiguration {

    private final ApplicationContext applicationContext;

    public WorkflowEngineAutoConfiguration(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
        log.info("工作流引擎自动配置 (WorkflowEngineAutoConfiguration) 已加载。");
    }

    /**
     * 提供后台执行使用的 Reactor Scheduler Bean。
     * 如果已存在名为 "workflowExecutionScheduler" 的 Bean，则不创建此默认 Bean。
     */
    @Bean(name = "workflowExecutionScheduler", destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = "workflowExecutionScheduler")
    public Scheduler workflowExecutionScheduler(WorkflowEngineProperties properties) {
        WorkflowEngineProperties.SchedulerProps schedulerProps = properties.getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();

        switch (schedulerProps.getType()) {
            case BOUNDED_ELASTIC:
                log.info("正在创建 'workflowExecutionScheduler' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s",
                        namePrefix, schedulerProps.getBoundedElastic().getThreadCap(),
                        schedulerProps.getBoundedElastic().getQueuedTaskCap(), schedulerProps.getBoundedElastic().getTtlSeconds());
                return newBoundedElastic(schedulerProps, namePrefix);
            case PARALLEL:
                WorkflowEngineProperties.ParallelProps pProps = schedulerProps.getParallel();
                log.info("正在创建 'workflowExecutionScheduler' (Parallel): prefix={}, parallelism={}", namePrefix, pProps.getParallelism());
                return Schedulers.newParallel(namePrefix, pProps.getParallelism(), true);
            case SINGLE:
                log.info("正在创建 'workflowExecutionScheduler' (Single): prefix={}", namePrefix);
                return Schedulers.newSingle(namePrefix, true);
            case CUSTOM:
                String customBeanName = schedulerProps.getCustomBeanName();
                if (customBeanName == null || customBeanName.trim().isEmpty()) {
                    log.error("'workflow.scheduler.type=CUSTOM' 但 'workflow.scheduler.custom-bean-name' 未配置。回退到默认 BoundedElastic。");
                    return newBoundedElastic(schedulerProps, namePrefix + "-fallback");
                }
                log.info("正在从 Spring 上下文获取自定义 'workflowExecutionScheduler' Bean，名称: {}", customBeanName);
                try {
                    return applicationContext.getBean(customBeanName, Scheduler.class);
                } catch (Exception e) {
                    log.error("获取自定义 Scheduler Bean '{}' 失败。回退到默认 BoundedElastic。", customBeanName, e);
                    return newBoundedElastic(schedulerProps, namePrefix + "-fallback-custom-failed");
                }
            default:
                log.warn("未知的 'workflow.scheduler.type': {}. 回退到默认 BoundedElastic。", schedulerProps.getType());
                return newBoundedElastic(schedulerProps, namePrefix + "-default");
        }
    }

    private static Scheduler newBoundedElastic(WorkflowEngineProperties.SchedulerProps schedulerProps, String namePrefix) {
        WorkflowEngineProperties.BoundedElasticProps beProps = schedulerProps.getBoundedElastic();
        return Schedulers.newBoundedElastic(beProps.getThreadCap(), beProps.getQueuedTaskCap(), namePrefix, beProps.getTtlSeconds(), true);
    }

    /**
     * 收集在应用上下文中定义的所有 WorkflowMonitorListener Bean，
     * 作为名为 "workflowMonitorListeners" 的不可变列表 Bean 提供。
     */
    @Bean(name = "workflowMonitorListeners")
    @ConditionalOnMissingBean(name = "workflowMonitorListeners")
    public List<WorkflowMonitorListener> workflowMonitorListeners(ObjectProvider<WorkflowMonitorListener> listenersProvider) {
        log.info("正在收集 WorkflowMonitorListener Bean...");
        List<WorkflowMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 WorkflowMonitorListener Bean。");
        } else {
            log.info("收集到 {} 个 WorkflowMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return Collections.unmodifiableList(listeners);
    }

    @Bean
    @ConditionalOnMissingBean(WorkflowExecutor.class)
    public WorkflowExecutor workflowExecutor(WorkflowEngineProperties properties,
                                             @Qualifier("workflowExecutionScheduler") Scheduler workflowExecutionScheduler,
                                             @Qualifier("workflowMonitorListeners") List<WorkflowMonitorListener> workflowMonitorListeners) {
        log.info("正在创建 WorkflowExecutor Bean，配置: {}", properties);
        return new StandardWorkflowExecutor(properties.getEngine().getMaxIterations(),
                workflowExecutionScheduler, workflowMonitorListeners);
    }

    @Bean
    @ConditionalOnMissingBean(WorkflowRegistry.class)
    public WorkflowRegistry workflowRegistry() {
        return new InMemoryWorkflowRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(TemplateRegistry.class)
    public TemplateRegistry templateRegistry() {
        return new TemplateRegistry();
    }

    /**
     * 定期清理已结束的后台执行。可通过 {@code workflow.cleanup.enabled=false} 关闭。
     */
    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnMissingBean(ExecutionCleanupTask.class)
    @ConditionalOnProperty(prefix = "workflow.cleanup", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ExecutionCleanupTask executionCleanupTask(WorkflowEngineProperties properties,
                                                     WorkflowExecutor workflowExecutor,
                                                     @Qualifier("workflowExecutionScheduler") Scheduler workflowExecutionScheduler) {
        WorkflowEngineProperties.Cleanup cleanup = properties.getCleanup();
        return new ExecutionCleanupTask(workflowExecutor, workflowExecutionScheduler,
                cleanup.getRetention(), cleanup.getInterval());
    }

    @Bean
    @ConditionalOnMissingBean(LoggingWorkflowMonitorListener.class)
    @ConditionalOnProperty(prefix = "workflow.monitor", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    public LoggingWorkflowMonitorListener loggingWorkflowMonitorListener() {
        return new LoggingWorkflowMonitorListener();
    }

    /**
     * 仅当上下文中存在 MeterRegistry 时注册 Micrometer 监听器。
     */
    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MicrometerMonitorConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(MicrometerWorkflowMonitorListener.class)
        public MicrometerWorkflowMonitorListener micrometerWorkflowMonitorListener(MeterRegistry meterRegistry) {
            log.info("检测到 MeterRegistry，正在注册 MicrometerWorkflowMonitorListener。");
            return new MicrometerWorkflowMonitorListener(meterRegistry);
        }
    }
}
