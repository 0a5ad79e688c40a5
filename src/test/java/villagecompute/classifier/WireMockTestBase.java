package villagecompute.classifier;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;

/**
 * Abstract base class for tests that call HTTP services through WireMock.
 *
 * <p>
 * Starts a server on a random port before each test and stops it afterwards. Canned response bodies live under
 * {@code src/test/resources/wiremock/}.
 */
public abstract class WireMockTestBase {

    /** Path the zero-shot validator is served from in stubs. */
    protected static final String VALIDATOR_PATH = "/models/facebook/bart-large-mnli";

    protected WireMockServer wireMockServer;

    @BeforeEach
    protected void startWireMock() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        WireMock.configureFor("localhost", wireMockServer.port());
    }

    @AfterEach
    protected void stopWireMock() {
        if (wireMockServer != null && wireMockServer.isRunning()) {
            wireMockServer.resetAll();
            wireMockServer.stop();
        }
    }

    protected String validatorUrl() {
        return wireMockServer.baseUrl() + VALIDATOR_PATH;
    }

    /**
     * Stubs the zero-shot validator with a canned response.
     *
     * @param status
     *            HTTP status to answer with
     * @param stubFile
     *            body file relative to the test classpath, e.g. {@code wiremock/validator/model-loading.json}
     */
    protected void stubValidator(int status, String stubFile) {
        wireMockServer.stubFor(WireMock.post(WireMock.urlPathEqualTo(VALIDATOR_PATH)).willReturn(WireMock.aResponse()
                .withStatus(status).withHeader("Content-Type", "application/json").withBody(loadStubFile(stubFile))));
    }

    /**
     * Loads a stub file from the test classpath.
     *
     * @throws RuntimeException
     *             if the file is missing or unreadable
     */
    protected String loadStubFile(String path) {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new RuntimeException("Stub file not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load stub file: " + path, e);
        }
    }
}
