package dao.sol.bundler.config;

import dao.sol.bundler.service.BlockhashProvider;
import dao.sol.bundler.service.BundleSigner;
import dao.sol.bundler.service.LocalBundleSigner;
import dao.sol.bundler.service.RateLimiter;
import dao.sol.bundler.service.SidePaymentBundleSigner;
import dao.sol.bundler.util.Sleeper;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class DispatchConfig {

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    /**
     * One limiter per process: every dispatch path shares the same submission budget.
     */
    @Bean
    public RateLimiter rateLimiter(DispatchProperties props, Sleeper sleeper) {
        return new RateLimiter(props.getMaxBundlesPerSecond(), System::currentTimeMillis, sleeper);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService dispatchExecutor(DispatchProperties props) {
        // capped at 32 threads
        int threads = Math.max(1, Math.min(32, props.getMaxParallel()));
        return Executors.newFixedThreadPool(threads);
    }

    /**
     * Times the staggered all-in-one sends. Its thread only hands work to {@code dispatchExecutor}.
     */
    @Bean
    public ThreadPoolTaskScheduler staggerTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("stagger-");
        return scheduler;
    }

    @Bean
    public RestClient.Builder outboundRestClientBuilder(TradingServerProperties props) {
        ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .withReadTimeout(Duration.ofMillis(props.getReadTimeoutMs()));
        return RestClient.builder().requestFactory(ClientHttpRequestFactories.get(settings));
    }

    @Bean
    public BundleSigner bundleSigner(SidePaymentProperties sidePayment, BlockhashProvider blockhashProvider) {
        return new SidePaymentBundleSigner(new LocalBundleSigner(), sidePayment, blockhashProvider);
    }
}
