package com.convoviewer.viewer.config;

import com.convoviewer.viewer.adapter.SourceAdapterRegistry;
import com.convoviewer.viewer.cache.TieredCacheManager;
import com.convoviewer.viewer.model.Source;
import com.convoviewer.viewer.search.SearchAggregator;
import com.convoviewer.viewer.service.ConversationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for the global search fan-out, one task per source.
 */
@Slf4j
@Configuration
public class SearchConfig {

    @Bean(name = "searchExecutor")
    public ThreadPoolTaskExecutor searchExecutor(@Value("${app.search.queue-capacity:50}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        // One thread per source keeps a single request fully parallel
        executor.setCorePoolSize(Source.values().length);
        executor.setMaxPoolSize(Source.values().length * 2);
        executor.setQueueCapacity(queueCapacity);

        executor.setThreadNamePrefix("search-");

        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(5);

        executor.initialize();

        log.info("Search executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                executor.getQueueCapacity());

        return executor;
    }

    @Bean
    public SearchAggregator searchAggregator(SourceAdapterRegistry registry,
                                             ConversationService conversationService,
                                             TieredCacheManager cache,
                                             @Qualifier("searchExecutor") ThreadPoolTaskExecutor searchExecutor,
                                             @Value("${app.search.source-timeout-ms:10000}") long sourceTimeoutMs,
                                             @Value("${app.search.preview-count:3}") int previewCount) {
        return new SearchAggregator(registry, conversationService, cache, searchExecutor, sourceTimeoutMs, previewCount);
    }
}
