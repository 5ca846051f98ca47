package io.marketminer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.marketminer.JobAdmission;
import io.marketminer.core.DispatchTarget;
import io.marketminer.internal.BoundaryCalls;
import io.marketminer.internal.DefaultJobAdmission;
import io.marketminer.internal.DispatchSubmitter;
import io.marketminer.internal.QueueProvisioner;
import io.marketminer.internal.QueuedJobReconciler;
import io.marketminer.internal.mongo.MongoDispatchQueueService;
import io.marketminer.internal.mongo.MongoJobRecordStore;
import io.marketminer.spi.DispatchQueueService;
import io.marketminer.spi.JobRecordStore;
import io.marketminer.spi.QueuedJobSweeper;
import io.marketminer.utils.QueueNames;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.net.URI;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring Boot auto-configuration entrypoint for job admission.
 *
 * <p>Stores default to MongoDB; declare a {@link JobRecordStore} or {@link DispatchQueueService} bean to
 * replace either one.
 */
@AutoConfiguration(after = MongoDataAutoConfiguration.class)
@ConditionalOnClass({JobAdmission.class, MongoTemplate.class})
@EnableConfigurationProperties(MarketMinerProperties.class)
@ConditionalOnProperty(prefix = "marketminer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MarketMinerConfig {

    public static final String BOUNDARY_EXECUTOR_BEAN = "marketMinerBoundaryExecutor";

    @Bean
    @ConditionalOnMissingBean(JobRecordStore.class)
    public MongoJobRecordStore mongoJobRecordStore(MongoTemplate mongoTemplate) {
        return new MongoJobRecordStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(DispatchQueueService.class)
    public MongoDispatchQueueService mongoDispatchQueueService(MongoTemplate mongoTemplate) {
        return new MongoDispatchQueueService(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected MarketMinerMongoIndexConfig marketMinerMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new MarketMinerMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "marketminer", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton marketMinerIndexesInitializer(MarketMinerMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    @Bean(name = BOUNDARY_EXECUTOR_BEAN, destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = BOUNDARY_EXECUTOR_BEAN)
    public ExecutorService marketMinerBoundaryExecutor() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("marketminer.boundary-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public BoundaryCalls boundaryCalls(MarketMinerProperties props,
                                       @Qualifier(BOUNDARY_EXECUTOR_BEAN) ExecutorService executor) {
        return new BoundaryCalls(executor, props.getBoundaryTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueNames queueNames(MarketMinerProperties props) {
        return new QueueNames(props.getQueuePrefix());
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchTarget dispatchTarget(MarketMinerProperties props) {
        MarketMinerProperties.Dispatch d = props.getDispatch();
        requireText(d.getInvokerIdentity(), "marketminer.dispatch.invoker-identity");
        if (d.getTargetUri() != null && !d.getTargetUri().isBlank()) {
            return new DispatchTarget(URI.create(d.getTargetUri()), d.getInvokerIdentity());
        }
        requireText(d.getProject(), "marketminer.dispatch.project");
        requireText(d.getRegion(), "marketminer.dispatch.region");
        requireText(d.getWorkerJob(), "marketminer.dispatch.worker-job");
        return DispatchTarget.runJob(d.getProject(), d.getRegion(), d.getWorkerJob(), d.getInvokerIdentity());
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueProvisioner queueProvisioner(DispatchQueueService queueService, QueueNames queueNames, BoundaryCalls calls) {
        return new QueueProvisioner(queueService, queueNames, calls);
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchSubmitter dispatchSubmitter(DispatchQueueService queueService, QueueNames queueNames,
                                               DispatchTarget target, ObjectMapper om, BoundaryCalls calls) {
        return new DispatchSubmitter(queueService, queueNames, target, om, calls);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobAdmission jobAdmission(JobRecordStore store, QueueProvisioner provisioner,
                                     DispatchSubmitter submitter, BoundaryCalls calls) {
        return new DefaultJobAdmission(store, provisioner, submitter, calls);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "marketminer.reconciler", name = "enabled", havingValue = "true")
    public QueuedJobReconciler queuedJobReconciler(MarketMinerProperties props, QueuedJobSweeper sweeper) {
        MarketMinerProperties.Reconciler r = props.getReconciler();
        return new QueuedJobReconciler(sweeper, r.getInterval(), r.getStaleAfter(), r.getBatchSize());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "marketminer.reconciler", name = "enabled", havingValue = "true")
    public MarketMinerLifecycle marketMinerLifecycle(QueuedJobReconciler reconciler) {
        return new MarketMinerLifecycle(reconciler);
    }

    private static void requireText(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(property + " must be set");
        }
    }
}
