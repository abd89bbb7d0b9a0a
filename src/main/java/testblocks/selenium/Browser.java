package testblocks.selenium;

import testblocks.config.FrameworkConfig;
import org.openqa.selenium.Alert;
import org.openqa.selenium.By;
import org.openqa.selenium.Capabilities;
import org.openqa.selenium.ElementClickInterceptedException;
import org.openqa.selenium.ElementNotInteractableException;
import org.openqa.selenium.HasCapabilities;
import org.openqa.selenium.InvalidElementStateException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.Keys;
import org.openqa.selenium.NoAlertPresentException;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.NoSuchFrameException;
import org.openqa.selenium.NoSuchWindowException;
import org.openqa.selenium.NotFoundException;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.UnhandledAlertException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.edge.EdgeDriver;
import org.openqa.selenium.edge.EdgeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Convenience wrapper around a {@link WebDriver} whose lookups wait for the
 * page instead of failing on the first miss.
 *
 * <p>Closing a {@code Browser} quits its driver, so registering one as a
 * scoped service ties the browser session to a single test run:
 * <pre>{@code
 * builder.addScopedService(Browser.class, scope -> Browser.launch(BrowserType.CHROME, config));
 * }</pre>
 */
public class Browser implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Browser.class);

    private static final DateTimeFormatter SCREENSHOT_TS = DateTimeFormatter.ofPattern("yyyy.MM.dd_HH.mm.ss");

    private static final int SEND_KEYS_ATTEMPTS      = 5;
    private static final int DEFAULT_PIXELS_FROM_TOP = 200;

    @SuppressWarnings("unchecked")
    private static final Class<? extends Exception>[] INPUT_NOT_READY = new Class[] {
            ElementNotInteractableException.class,
            StaleElementReferenceException.class,
            InvalidElementStateException.class
    };

    private final WebDriver       driver;
    private final ConditionalWait wait;
    private final Path            screenshotDir;

    public Browser(WebDriver driver, FrameworkConfig config) {
        this(driver, new ConditionalWait(config.getWaitTimeout(), config.getWaitPollInterval()),
                Paths.get(config.getScreenshotDir()));
    }

    public Browser(WebDriver driver, ConditionalWait wait, Path screenshotDir) {
        this.driver        = Objects.requireNonNull(driver, "driver");
        this.wait          = Objects.requireNonNull(wait, "wait");
        this.screenshotDir = Objects.requireNonNull(screenshotDir, "screenshotDir");
    }

    /**
     * Starts a local browser of the given type, maximized, with the
     * configured page-load timeout. Selenium Manager resolves the driver binary.
     */
    public static Browser launch(BrowserType type, FrameworkConfig config) {
        boolean headless = config.isBrowserHeadless();
        log.info("Launching {} (headless={})", type, headless);

        WebDriver driver = switch (type) {
            case CHROME -> {
                ChromeOptions opts = new ChromeOptions();
                opts.addArguments("--disable-extensions", "--no-sandbox", "--disable-infobars");
                opts.setExperimentalOption("prefs", Map.of(
                        "credentials_enable_service", false,
                        "profile.password_manager_enabled", false));
                if (headless) opts.addArguments("--headless=new");
                yield new ChromeDriver(opts);
            }
            case FIREFOX -> {
                FirefoxOptions opts = new FirefoxOptions();
                if (headless) opts.addArguments("-headless");
                yield new FirefoxDriver(opts);
            }
            case EDGE -> {
                EdgeOptions opts = new EdgeOptions();
                opts.addArguments("--disable-extensions");
                if (headless) opts.addArguments("--headless=new");
                yield new EdgeDriver(opts);
            }
        };

        driver.manage().window().maximize();
        driver.manage().timeouts().pageLoadTimeout(config.getPageLoadTimeout());
        return new Browser(driver, config);
    }

    public WebDriver getDriver() {
        return driver;
    }

    // ── Element lookup ────────────────────────────────────────────────────

    /**
     * Waits until {@code by} matches an element and returns it. To check that
     * an element does NOT exist, use {@code getDriver().findElements(by)}.
     *
     * @throws WaitTimeoutException if nothing matches before the default timeout
     */
    public WebElement findElement(By by) {
        return findElement(by, wait);
    }

    public WebElement findElement(By by, int secondsToWait) {
        return findElement(by, wait.withTimeout(Duration.ofSeconds(secondsToWait)));
    }

    private WebElement findElement(By by, ConditionalWait w) {
        log.debug("Attempting to find element using selector: {}", by);
        return w.until(() -> driver.findElement(by),
                NoSuchElementException.class, StaleElementReferenceException.class);
    }

    /**
     * Waits until {@code by} matches at least one element and returns all matches.
     *
     * @throws WaitTimeoutException if nothing matches before the default timeout
     */
    public List<WebElement> findElements(By by) {
        return findElements(by, wait);
    }

    public List<WebElement> findElements(By by, int secondsToWait) {
        return findElements(by, wait.withTimeout(Duration.ofSeconds(secondsToWait)));
    }

    private List<WebElement> findElements(By by, ConditionalWait w) {
        log.debug("Attempting to find all elements using selector: {}", by);
        return w.until(() -> {
            List<WebElement> found = driver.findElements(by);
            if (found.isEmpty()) {
                throw new NoSuchElementException("No element matches " + by);
            }
            return new ArrayList<>(found);
        }, NoSuchElementException.class);
    }

    // ── Conditions ────────────────────────────────────────────────────────

    /**
     * Evaluates {@code condition} until it is true, tolerating the usual
     * transient element exceptions.
     *
     * @return {@code true} once the condition holds, {@code false} on timeout
     */
    public boolean waitFor(BooleanSupplier condition) {
        return waitFor(condition, wait);
    }

    public boolean waitFor(BooleanSupplier condition, int secondsToWait) {
        return waitFor(condition, wait.withTimeout(Duration.ofSeconds(secondsToWait)));
    }

    private boolean waitFor(BooleanSupplier condition, ConditionalWait w) {
        try {
            w.untilTrue(condition,
                    NoSuchElementException.class,
                    StaleElementReferenceException.class,
                    ElementNotInteractableException.class,
                    InvalidElementStateException.class);
            return true;
        } catch (WaitTimeoutException e) {
            log.debug("waitFor timed out: {}", e.getMessage());
            return false;
        }
    }

    // ── Elements ──────────────────────────────────────────────────────────

    /**
     * Waits until {@code by} matches an element below {@code parent} and returns it.
     *
     * @throws WaitTimeoutException if nothing matches before the default timeout
     */
    public WebElement findElementIn(WebElement parent, By by) {
        return findElementIn(parent, by, wait);
    }

    public WebElement findElementIn(WebElement parent, By by, int secondsToWait) {
        return findElementIn(parent, by, wait.withTimeout(Duration.ofSeconds(secondsToWait)));
    }

    private WebElement findElementIn(WebElement parent, By by, ConditionalWait w) {
        log.debug("Attempting to find child element using selector: {}", by);
        return w.until(() -> parent.findElement(by),
                NoSuchElementException.class, StaleElementReferenceException.class);
    }

    /** Waits until {@code by} matches at least one element below {@code parent}. */
    public List<WebElement> findElementsIn(WebElement parent, By by) {
        return findElementsIn(parent, by, wait);
    }

    public List<WebElement> findElementsIn(WebElement parent, By by, int secondsToWait) {
        return findElementsIn(parent, by, wait.withTimeout(Duration.ofSeconds(secondsToWait)));
    }

    private List<WebElement> findElementsIn(WebElement parent, By by, ConditionalWait w) {
        log.debug("Attempting to find all child elements using selector: {}", by);
        return w.until(() -> {
            List<WebElement> found = parent.findElements(by);
            if (found.isEmpty()) {
                throw new NoSuchElementException("No child element matches " + by);
            }
            return new ArrayList<>(found);
        }, NoSuchElementException.class, StaleElementReferenceException.class);
    }

    /**
     * Clears {@code element} and types {@code text}. Some inputs drop the
     * first keystrokes while they initialise, so a mismatching value gets
     * one more clear and type.
     */
    public void sendKeysReplace(WebElement element, String text) {
        element.clear();
        element.sendKeys(text);
        if (!Objects.equals(text, element.getAttribute("value"))) {
            log.debug("Value mismatch after typing, retrying once");
            element.clear();
            element.sendKeys(text);
        }
    }

    /**
     * Clears {@code element} and types {@code text} once it accepts input,
     * retrying until its {@code value} attribute reads back as {@code text}.
     *
     * @throws WaitTimeoutException if the element never becomes ready, or
     *                              never holds {@code text} after
     *                              five attempts
     */
    public void sendKeysWhenReady(WebElement element, String text) {
        sendKeysWhenReady(element, text, wait);
    }

    public void sendKeysWhenReady(WebElement element, String text, int secondsToWait) {
        sendKeysWhenReady(element, text, wait.withTimeout(Duration.ofSeconds(secondsToWait)));
    }

    private void sendKeysWhenReady(WebElement element, String text, ConditionalWait w) {
        for (int attempt = 1; attempt <= SEND_KEYS_ATTEMPTS; attempt++) {
            w.untilNoException(element::clear, INPUT_NOT_READY);
            w.untilNoException(() -> element.sendKeys(text), INPUT_NOT_READY);
            if (Objects.equals(text, element.getAttribute("value"))) {
                return;
            }
            log.debug("Typed value not accepted (attempt {}/{})", attempt, SEND_KEYS_ATTEMPTS);
        }
        throw new WaitTimeoutException("Element did not accept the value after "
                + SEND_KEYS_ATTEMPTS + " attempts");
    }

    /** {@link #sendKeysWhenReady(WebElement, String)}, then TAB out of the field. */
    public void sendKeysAndTabWhenReady(WebElement element, String text) {
        sendKeysWhenReady(element, text);
        element.sendKeys(Keys.TAB);
    }

    public void sendKeysAndTabWhenReady(WebElement element, String text, int secondsToWait) {
        sendKeysWhenReady(element, text, secondsToWait);
        element.sendKeys(Keys.TAB);
    }

    /** Clicks {@code element}, retrying while it is covered, stale or not yet interactable. */
    public void clickWhenReady(WebElement element) {
        clickWhenReady(element, wait);
    }

    public void clickWhenReady(WebElement element, int secondsToWait) {
        clickWhenReady(element, wait.withTimeout(Duration.ofSeconds(secondsToWait)));
    }

    private void clickWhenReady(WebElement element, ConditionalWait w) {
        w.untilNoException(element::click,
                ElementNotInteractableException.class,
                StaleElementReferenceException.class,
                InvalidElementStateException.class,
                ElementClickInterceptedException.class,
                NoSuchElementException.class);
    }

    /** Scrolls the window so {@code element} sits 200px below the top edge. */
    public void scrollIntoView(WebElement element) {
        scrollIntoView(element, DEFAULT_PIXELS_FROM_TOP);
    }

    public void scrollIntoView(WebElement element, int pixelsFromTop) {
        int position = element.getLocation().getY() - pixelsFromTop;
        ((JavascriptExecutor) driver).executeScript("window.scrollTo(0," + position + ")");
    }

    // ── Frames, windows, alerts ───────────────────────────────────────────

    /**
     * Switches into each frame in turn, so nested frames can be entered in one call.
     * Starts from the current browsing context.
     */
    public void switchToFrames(By... frames) {
        for (By by : frames) {
            log.debug("Switching to frame: {}", by);
            wait.untilNoException(() -> driver.switchTo().frame(driver.findElement(by)),
                    NoSuchFrameException.class,
                    NoSuchElementException.class,
                    StaleElementReferenceException.class,
                    NotFoundException.class);
        }
    }

    /**
     * Switches to the first other window whose title equals {@code title}.
     *
     * @return {@code true} if found; otherwise focus is returned to the
     *         original window and {@code false} is returned
     */
    public boolean switchWindow(String title) {
        String current = wait.until(driver::getWindowHandle, NoSuchWindowException.class);
        List<String> handles = new ArrayList<>(driver.getWindowHandles());

        for (String handle : handles) {
            if (handle.equals(current)) continue;
            wait.untilNoException(() -> driver.switchTo().window(handle), NoSuchWindowException.class);
            if (Objects.equals(driver.getTitle(), title)) {
                log.info("Switched to window '{}'", title);
                return true;
            }
            driver.switchTo().window(current);
        }
        log.debug("No window titled '{}' among {} handle(s)", title, handles.size());
        return false;
    }

    /** Waits for a JavaScript alert, confirm or prompt and returns it. */
    public Alert alert() {
        return wait.until(() -> driver.switchTo().alert(),
                NoAlertPresentException.class, UnhandledAlertException.class);
    }

    // ── Evidence ──────────────────────────────────────────────────────────

    /**
     * Saves a PNG of the current page to the screenshot directory.
     *
     * @return the file written, or {@code null} if the driver cannot take screenshots
     * @throws IOException if the file cannot be written
     */
    public Path takeScreenshot() throws IOException {
        if (!(driver instanceof TakesScreenshot)) {
            log.warn("Driver {} does not support screenshots", driver.getClass().getSimpleName());
            return null;
        }
        String browserName = "browser";
        if (driver instanceof HasCapabilities) {
            Capabilities caps = ((HasCapabilities) driver).getCapabilities();
            if (caps != null && caps.getBrowserName() != null && !caps.getBrowserName().isBlank()) {
                browserName = caps.getBrowserName();
            }
        }
        Files.createDirectories(screenshotDir);
        Path target = screenshotDir.resolve(browserName + "_" + LocalDateTime.now().format(SCREENSHOT_TS) + ".png");
        byte[] png = ((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES);
        Files.write(target, png);
        log.info("Saved screenshot to {}", target);
        return target;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────

    /** Quits the underlying driver. */
    @Override
    public void close() {
        log.debug("Quitting {}", driver.getClass().getSimpleName());
        driver.quit();
    }
}
