package com.echelon.controlplane.config;

import com.echelon.kernel.audit.AuditEntryFactory;
import com.echelon.kernel.audit.AuditLog;
import com.echelon.kernel.audit.AuditSink;
import com.echelon.kernel.audit.Slf4jAuditSink;
import com.echelon.kernel.ceiling.CeilingEnforcer;
import com.echelon.kernel.config.KernelSettings;
import com.echelon.kernel.idempotency.IdempotencyStore;
import com.echelon.kernel.identity.IdentityResolver;
import com.echelon.kernel.ratelimit.FixedWindowCounter;
import com.echelon.kernel.ratelimit.RateLimiter;
import com.echelon.kernel.registry.Pack;
import com.echelon.kernel.registry.PackRegistry;
import com.echelon.kernel.router.ActionRouter;
import com.echelon.kernel.store.InMemoryKernelStore;
import com.echelon.kernel.store.KernelStore;
import com.echelon.kernel.store.StoreRetrier;
import com.echelon.kernel.verification.VerificationService;
import com.echelon.observability.MetricFactory;
import com.echelon.observability.SensitiveDataRedactor;
import com.echelon.observability.SpanHelper;
import com.echelon.security.CredentialRepository;
import com.echelon.security.SecretHasher;
import com.echelon.security.TenantRepository;
import com.echelon.security.TenantVerifier;
import com.echelon.security.VerificationTokenRepository;
import com.echelon.security.memory.InMemoryCredentialRepository;
import com.echelon.security.memory.InMemoryTenantRepository;
import com.echelon.security.memory.InMemoryVerificationTokenRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the kernel from the framework-free libraries.
 *
 * <p>Storage beans are in-memory and {@link ConditionalOnMissingBean}, so a deployment swaps in
 * durable adapters by declaring its own {@link KernelStore} or repositories.
 */
@Configuration
public class KernelConfiguration {

    private static final Logger log = LoggerFactory.getLogger(KernelConfiguration.class);

    @Bean
    public KernelSettings kernelSettings(ControlPlaneProperties properties) {
        return properties.toSettings();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public OpenTelemetry openTelemetry() {
        return GlobalOpenTelemetry.get();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry,
                                       @Value("${spring.application.name:echelon-control-plane}") String name) {
        return new MetricFactory(registry, name);
    }

    @Bean
    public SpanHelper spanHelper(OpenTelemetry openTelemetry) {
        return new SpanHelper(openTelemetry.getTracer("com.echelon.kernel"));
    }

    @Bean
    public SecretHasher secretHasher(ControlPlaneProperties properties) {
        if (properties.keyPepper() == null || properties.keyPepper().isBlank()) {
            log.warn("No key pepper configured; API keys and verification tokens are hashed with plain SHA-256");
            return SecretHasher.sha256();
        }
        return SecretHasher.withPepper(properties.keyPepper());
    }

    @Bean
    @ConditionalOnMissingBean
    public TenantRepository tenantRepository() {
        return new InMemoryTenantRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialRepository credentialRepository() {
        return new InMemoryCredentialRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public VerificationTokenRepository verificationTokenRepository() {
        return new InMemoryVerificationTokenRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public KernelStore kernelStore(Clock clock) {
        return new InMemoryKernelStore(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditSink auditSink() {
        return new Slf4jAuditSink();
    }

    @Bean
    public StoreRetrier storeRetrier(KernelSettings settings) {
        return new StoreRetrier(settings.storeRetryAttempts(), settings.storeRetryBackoff());
    }

    @Bean
    public FixedWindowCounter fixedWindowCounter(KernelStore store, Clock clock, StoreRetrier retrier) {
        return new FixedWindowCounter(store, clock, retrier);
    }

    @Bean(destroyMethod = "close")
    public AuditLog auditLog(AuditSink sink, KernelSettings settings, MetricFactory metrics) {
        return new AuditLog(sink, settings.auditQueueCapacity(), settings.auditFlushInterval(), metrics);
    }

    @Bean
    public AuditEntryFactory auditEntryFactory(Clock clock) {
        return new AuditEntryFactory(new SensitiveDataRedactor(), clock);
    }

    @Bean
    public PackRegistry packRegistry(List<Pack> packs) {
        return PackRegistry.build(packs);
    }

    @Bean
    public IdentityResolver identityResolver(TenantRepository tenants, CredentialRepository credentials,
                                             SecretHasher hasher, Clock clock, StoreRetrier retrier) {
        return new IdentityResolver(tenants, credentials, hasher, clock, retrier);
    }

    @Bean
    public IdempotencyStore idempotencyStore(KernelStore store, Clock clock, StoreRetrier retrier,
                                             KernelSettings settings) {
        return new IdempotencyStore(store, clock, retrier, settings.idempotencyTtl(),
                settings.idempotencyInFlightTtl(), settings.idempotencyWait(), settings.idempotencyPoll());
    }

    @Bean
    public CeilingEnforcer ceilingEnforcer(FixedWindowCounter counter, KernelSettings settings,
                                           MetricFactory metrics) {
        return new CeilingEnforcer(counter, settings.ceilings(), metrics);
    }

    @Bean
    public RateLimiter rateLimiter(FixedWindowCounter counter, KernelSettings settings, MetricFactory metrics) {
        return new RateLimiter(counter, settings.rateLimits(), metrics);
    }

    @Bean
    public ThreadPoolTaskExecutor actionHandlerExecutor(ControlPlaneProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.handlerThreads());
        executor.setMaxPoolSize(properties.handlerThreads());
        executor.setThreadNamePrefix("echelon-handler-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Bean
    public ActionRouter actionRouter(IdentityResolver resolver, PackRegistry registry, IdempotencyStore idempotency,
                                     CeilingEnforcer ceilings, RateLimiter rateLimiter, AuditLog auditLog,
                                     AuditEntryFactory auditEntries, SpanHelper spans, MetricFactory metrics,
                                     Clock clock, ThreadPoolTaskExecutor actionHandlerExecutor,
                                     KernelSettings settings) {
        return new ActionRouter(resolver, registry, idempotency, ceilings, rateLimiter, auditLog, auditEntries,
                spans, metrics, clock, actionHandlerExecutor.getThreadPoolExecutor(), settings.defaultTimeout());
    }

    @Bean
    public TenantVerifier tenantVerifier(TenantRepository tenants, VerificationTokenRepository tokens,
                                         SecretHasher hasher, Clock clock, KernelSettings settings) {
        return new TenantVerifier(tenants, tokens, hasher, clock, settings.verificationTokenTtl());
    }

    @Bean
    public VerificationService verificationService(TenantVerifier verifier, AuditLog auditLog,
                                                   AuditEntryFactory auditEntries, MetricFactory metrics,
                                                   Clock clock) {
        return new VerificationService(verifier, auditLog, auditEntries, metrics, clock);
    }
}
