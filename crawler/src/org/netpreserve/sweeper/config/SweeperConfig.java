package org.netpreserve.sweeper.config;

/**
 * Root configuration, merged from the built-in defaults and the job directory's config.yaml.
 *
 * @param crawl     per-target crawl behaviour and limits
 * @param browser   how to start the rendering browser
 * @param storage   where the ledger lives
 * @param stream    where item events are published
 * @param selectors how to read the target site's pages
 * @param fanout    parallelism and retry behaviour for a run over many targets
 */
public record SweeperConfig(
        CrawlConfig crawl,
        BrowserConfig browser,
        StorageConfig storage,
        StreamConfig stream,
        SelectorsConfig selectors,
        FanoutConfig fanout
) {
}
