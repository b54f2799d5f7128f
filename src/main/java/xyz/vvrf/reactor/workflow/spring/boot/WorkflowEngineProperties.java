package xyz.vvrf.reactor.workflow.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 工作流引擎的配置属性类。
 * 绑定 'workflow' 前缀下的属性。
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "workflow")
@Validated
public class WorkflowEngineProperties {

    @Valid
    private final Engine engine = new Engine();
    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final Cleanup cleanup = new Cleanup();
    @Valid
    private final Monitor monitor = new Monitor();

    @Getter
    @Setter
    public static class Engine {
        /**
         * 单次执行允许的最大迭代次数 (节点调用次数)，超过即视为失控循环。
         */
        @Min(1)
        private int maxIterations = 100;
    }

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 后台执行使用的调度器类型。
         */
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        /**
         * 调度器线程名称前缀。
         */
        private String namePrefix = "workflow-exec";

        @Valid
        private final BoundedElasticProps boundedElastic = new BoundedElasticProps();

        @Valid
        private final ParallelProps parallel = new ParallelProps();

        /**
         * 当 type 为 CUSTOM 时，自定义 Scheduler Bean 的名称。
         */
        private String customBeanName;
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, SINGLE, CUSTOM
    }

    @Getter
    @Setter
    public static class BoundedElasticProps {
        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;
        @Min(0)
        private int ttlSeconds = 60;
    }

    @Getter
    @Setter
    public static class ParallelProps {
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    @Getter
    @Setter
    public static class Cleanup {
        /**
         * 是否定期清理已结束的后台执行。
         */
        private boolean enabled = true;

        /**
         * 已结束执行的保留时长。
         */
        @NotNull
        private Duration retention = Duration.ofHours(1);

        /**
         * 清理间隔。
         */
        @NotNull
        private Duration interval = Duration.ofMinutes(10);
    }

    @Getter
    @Setter
    public static class Monitor {
        /**
         * 是否注册日志监控监听器。
         */
        private boolean loggingEnabled = true;
    }

    @Override
    public String toString() {
        return "WorkflowEngineProperties{" +
                "engine={maxIterations=" + engine.maxIterations +
                "}, scheduler={type=" + scheduler.type +
                ", namePrefix='" + scheduler.namePrefix + '\'' +
                ", boundedElastic={threadCap=" + scheduler.boundedElastic.threadCap +
                ", queuedTaskCap=" + scheduler.boundedElastic.queuedTaskCap +
                ", ttlSeconds=" + scheduler.boundedElastic.ttlSeconds +
                "}, parallel={parallelism=" + scheduler.parallel.parallelism +
                "}, customBeanName='" + scheduler.customBeanName + '\'' +
                "}, cleanup={enabled=" + cleanup.enabled +
                ", retention=" + cleanup.retention +
                ", interval=" + cleanup.interval +
                "}, monitor={loggingEnabled=" + monitor.loggingEnabled +
                "}}";
    }
}
