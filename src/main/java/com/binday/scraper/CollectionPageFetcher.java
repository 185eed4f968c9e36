package com.binday.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.SelectOption;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Drives the council's collection-day web form with Playwright and returns the results page.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Opens the form, types the postcode and submits it.</li>
 *   <li>Waits for the address dropdown to populate and selects the configured address, falling back to
 *       a script-driven selection when the dropdown is hidden or the label only partially matches.</li>
 *   <li>Requests the collection days and waits for the results table.</li>
 * </ul>
 * On failure the page HTML and a screenshot are saved under {@code scraped-data/} before a
 * {@link PageFetchException} is thrown.
 *
 * @author Bin Collection Scraper Team
 * @since 1.0
 */
public class CollectionPageFetcher implements PageFetcherInterface {
    private static final Logger logger = LoggerFactory.getLogger(CollectionPageFetcher.class);

    private static final String POSTCODE_INPUT_XPATH = "xpath="
        + "//label[contains(text(), 'Enter a postcode') or contains(text(), 'postcode')]/following::input[@type='text'] | "
        + "//label[contains(text(), 'Enter a postcode') or contains(text(), 'postcode')]/../input[@type='text'] | "
        + "//form//input[@type='text' and (contains(@name, 'postcode') or contains(@id, 'postcode'))] | "
        + "//*[contains(@class, 'form') or contains(@id, 'form')]//input[@type='text'][not(contains(@class, 'search') or contains(@id, 'search'))]";
    private static final String FIND_BUTTON_XPATH = "xpath="
        + "//button[contains(., 'Find') or contains(text(), 'Find')] | "
        + "//input[@type='submit' and contains(@value, 'Find')] | //button[@type='submit']";
    private static final String ADDRESS_SELECT = "#PCSelectp1";
    private static final String NEXT_BUTTON = "#nextBtn";

    private static final String READ_OPTIONS_SCRIPT = "() => {"
        + " var select = document.querySelector('#PCSelectp1') || document.querySelector('select');"
        + " if (!select) return [];"
        + " var options = [];"
        + " for (var i = 0; i < select.options.length; i++) {"
        + "   var opt = select.options[i];"
        + "   if (opt.value && opt.text) options.push({value: opt.value, text: opt.text.trim()});"
        + " }"
        + " return options; }";
    private static final String SET_OPTION_SCRIPT = "(value) => {"
        + " var select = document.querySelector('#PCSelectp1') || document.querySelector('select');"
        + " if (!select) return false;"
        + " select.value = value;"
        + " select.dispatchEvent(new Event('change', { bubbles: true }));"
        + " return select.value === value; }";

    private static final int KEY_DELAY_MS = 50;
    private static final int OPTION_POLLS = 20;

    private final String url;
    private final boolean headless;

    public CollectionPageFetcher(String url, boolean headless) {
        this.url = url == null || url.isBlank() ? ScraperConfig.DEFAULT_URL : url;
        this.headless = headless;
    }

    public CollectionPageFetcher(ScraperConfig config) {
        this(config.url, config.headless);
    }

    @Override
    public String fetchResultsHtml(String postcode, String addressLine) {
        if (postcode == null || postcode.isBlank() || addressLine == null || addressLine.isBlank()) {
            throw new IllegalArgumentException("postcode and addressLine are required");
        }
        try (Playwright playwright = Playwright.create()) {
            Browser browser = playwright.chromium().launch(getDefaultLaunchOptions());
            try {
                Page page = browser.newContext().newPage();
                try {
                    openForm(page);
                    enterPostcode(page, postcode);
                    selectAddress(page, addressLine);
                    requestCollectionDays(page);
                    String html = page.content();
                    logger.info("Fetched results page ({} chars) for {}", html.length(), addressLine);
                    return html;
                } catch (PlaywrightException | PageFetchException e) {
                    saveDebugArtifacts(page);
                    if (e instanceof PageFetchException) throw (PageFetchException) e;
                    throw new PageFetchException("Failed to load collection results: " + e.getMessage(), e);
                }
            } finally {
                browser.close();
            }
        } catch (PlaywrightException e) {
            logger.error("Playwright initialization error: {}", e.getMessage());
            throw new PageFetchException("Could not start browser: " + e.getMessage(), e);
        }
    }

    private BrowserType.LaunchOptions getDefaultLaunchOptions() {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions();
        options.setHeadless(headless);
        options.setArgs(Arrays.asList(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--lang=en-GB"
        ));
        return options;
    }

    private void openForm(Page page) {
        logger.info("Opening collection-day form: {}", url);
        Boolean loaded = Utils.retryPlaywrightAction(() -> {
            page.navigate(url, new Page.NavigateOptions().setWaitUntil(WaitUntilState.NETWORKIDLE));
            return true;
        }, 3, "navigate to collection-day form");
        if (loaded == null) {
            throw new PageFetchException("Could not open " + url);
        }
    }

    private void enterPostcode(Page page, String postcode) {
        Locator input = page.locator(POSTCODE_INPUT_XPATH).first();
        input.click();
        input.fill("");
        input.pressSequentially(postcode, new Locator.PressSequentiallyOptions().setDelay(KEY_DELAY_MS));
        Utils.randomWait(page);

        if (!postcode.equals(input.inputValue())) {
            logger.warn("Postcode field reads '{}', retyping.", input.inputValue());
            input.fill("");
            input.pressSequentially(postcode, new Locator.PressSequentiallyOptions().setDelay(KEY_DELAY_MS));
            Utils.randomWait(page);
        }

        page.locator(FIND_BUTTON_XPATH).first().click();
        logger.info("Submitted postcode {}", postcode);
    }

    private void selectAddress(Page page, String addressLine) {
        logger.info("Waiting for address dropdown to load...");
        Locator select;
        try {
            page.waitForSelector(ADDRESS_SELECT, new Page.WaitForSelectorOptions()
                .setState(WaitForSelectorState.ATTACHED).setTimeout(10_000));
            select = page.locator(ADDRESS_SELECT);
        } catch (PlaywrightException e) {
            page.waitForSelector("select", new Page.WaitForSelectorOptions()
                .setState(WaitForSelectorState.ATTACHED).setTimeout(10_000));
            select = page.locator("select").first();
        }

        try {
            select.waitFor(new Locator.WaitForOptions().setState(WaitForSelectorState.VISIBLE).setTimeout(10_000));
        } catch (PlaywrightException e) {
            logger.warn("Address dropdown found but not visible, attempting to use it anyway.");
        }

        Utils.randomWait(page);
        for (int i = 0; i < OPTION_POLLS && select.locator("option").count() <= 1; i++) {
            Utils.randomWait(page);
        }
        Utils.randomWait(page);

        try {
            select.selectOption(new SelectOption().setLabel(addressLine));
            logger.info("Selected address '{}'", addressLine);
        } catch (PlaywrightException e) {
            logger.warn("Normal address selection failed ({}), trying script fallback.", e.getMessage());
            selectAddressByScript(page, addressLine);
        }
        Utils.randomWait(page);
    }

    private void selectAddressByScript(Page page, String addressLine) {
        Object raw = page.evaluate(READ_OPTIONS_SCRIPT);
        List<Map<String, String>> options = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object o : list) {
                if (o instanceof Map<?, ?> m) {
                    options.add(Map.of(
                        "value", String.valueOf(m.get("value")),
                        "text", String.valueOf(m.get("text"))));
                }
            }
        }
        if (options.isEmpty()) {
            throw new PageFetchException("Could not retrieve options from address dropdown");
        }
        logger.info("Address dropdown has {} options", options.size());
        options.stream().limit(5).forEach(o -> logger.debug("  - '{}' (value: {})", o.get("text"), o.get("value")));

        String value = chooseOptionValue(options, addressLine);
        if (value == null) {
            List<String> labels = options.stream().limit(10).map(o -> o.get("text")).toList();
            throw new PageFetchException("Could not find address '" + addressLine + "' in dropdown. Available options: " + labels);
        }
        Object ok = page.evaluate(SET_OPTION_SCRIPT, value);
        if (!Boolean.TRUE.equals(ok)) {
            throw new PageFetchException("Failed to set address dropdown to '" + value + "'");
        }
        logger.info("Selected address via script fallback.");
    }

    /**
     * Picks the dropdown value for an address: an exact label match, else the first label that
     * contains the address or is contained by it (case-insensitive).
     * @param options maps with "value" and "text" keys, in dropdown order
     * @param addressLine address to look for
     * @return matching option value, or null
     */
    static String chooseOptionValue(List<Map<String, String>> options, String addressLine) {
        for (Map<String, String> opt : options) {
            if (addressLine.equals(opt.get("text"))) return opt.get("value");
        }
        String wanted = addressLine.toLowerCase(Locale.ROOT);
        for (Map<String, String> opt : options) {
            String text = opt.get("text") == null ? "" : opt.get("text").toLowerCase(Locale.ROOT);
            if (text.isEmpty()) continue;
            if (text.contains(wanted) || wanted.contains(text)) {
                logger.info("Found partial address match: '{}'", opt.get("text"));
                return opt.get("value");
            }
        }
        return null;
    }

    private void requestCollectionDays(Page page) {
        logger.info("Requesting collection days...");
        Locator next = page.locator(NEXT_BUTTON);
        next.waitFor(new Locator.WaitForOptions().setState(WaitForSelectorState.VISIBLE).setTimeout(10_000));
        next.click();
        Utils.randomWait(page);
        page.waitForSelector("table", new Page.WaitForSelectorOptions()
            .setState(WaitForSelectorState.VISIBLE).setTimeout(20_000));
        logger.info("Collection dates loaded.");
    }

    private void saveDebugArtifacts(Page page) {
        try {
            Path dir = Paths.get("scraped-data");
            Files.createDirectories(dir);
            long stamp = System.currentTimeMillis();
            Files.writeString(dir.resolve("fetch-debug-" + stamp + ".html"), page.content());
            page.screenshot(new Page.ScreenshotOptions().setPath(dir.resolve("fetch-debug-" + stamp + ".png")).setFullPage(true));
            logger.info("Saved fetch debug HTML and screenshot to {}", dir);
        } catch (Exception e) {
            logger.error("Failed to save fetch debug artifacts: {}", e.getMessage());
        }
    }
}
