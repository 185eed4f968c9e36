package com.binday.scraper;

import com.microsoft.playwright.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Utility class for common helper methods used in scraping and file operations.
 *
 * @author Bin Collection Scraper Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private static final long DEFAULT_BACKOFF_MS = 1000;

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:,\\\\\\s]", "_");
    }

    /**
     * Retries a Playwright action up to maxRetries times with exponential backoff.
     * @param action Callable action to execute
     * @param maxRetries Maximum number of retries
     * @param actionDesc Description for logging
     * @param <T> Return type
     * @return Result of action, or null if all retries fail
     */
    public static <T> T retryPlaywrightAction(Callable<T> action, int maxRetries, String actionDesc) {
        return retryPlaywrightAction(action, maxRetries, actionDesc, DEFAULT_BACKOFF_MS);
    }

    /**
     * Retries an action with exponential backoff starting at {@code 2 * backoffMs}.
     * @return Result of action, or null if all retries fail or the thread is interrupted
     */
    public static <T> T retryPlaywrightAction(Callable<T> action, int maxRetries, String actionDesc, long backoffMs) {
        int attempts = 0;
        while (attempts < maxRetries) {
            try {
                return action.call();
            } catch (Exception e) {
                logger.warn("Failed {} (attempt {}): {}", actionDesc, attempts + 1, e.getMessage());
                attempts++;
                if (attempts >= maxRetries) break;
                try {
                    Thread.sleep((long) Math.pow(2, attempts) * backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while retrying {}", actionDesc);
                    return null;
                }
            }
        }
        logger.error("Giving up on {} after {} attempts.", actionDesc, maxRetries);
        return null;
    }

    /**
     * Pauses for a random 0.5-2 second interval so form interaction looks less robotic.
     * @param page Playwright page to wait on
     */
    public static void randomWait(Page page) {
        int ms = ThreadLocalRandom.current().nextInt(500, 2001);
        page.waitForTimeout(ms);
    }
}
