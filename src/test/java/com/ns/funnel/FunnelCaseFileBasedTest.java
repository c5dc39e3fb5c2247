package com.ns.funnel;

import com.ns.funnel.config.FunnelCompilerConfig;
import com.ns.funnel.config.FunnelDefinitionLoader;
import com.ns.funnel.context.FunnelResolutionException;
import com.ns.funnel.context.FunnelValidationException;
import com.ns.funnel.context.ValidationCode;
import com.ns.funnel.model.FunnelSpec;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Compiles every {@code funnel.yaml} under {@code funnel_cases/<group>/<case>/} and checks
 * the plan against the {@code expected.yaml} beside it: the plan kind and fragments the SQL
 * must or must not contain, or the error code compilation must fail with.
 * Run a subset with {@code -DtestFilter=<group or case>}.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class FunnelCaseFileBasedTest {

    private static final Logger logger = LoggerFactory.getLogger(FunnelCaseFileBasedTest.class);
    private static final String TEST_CASES_BASE_RESOURCE_DIR = "funnel_cases";
    private static final String FUNNEL_FILE = "funnel.yaml";
    private static final String EXPECTED_FILE = "expected.yaml";

    private FunnelCompilerConfig config;
    private FunnelQueryCompiler compiler;

    @BeforeAll
    void initializeCompiler() {
        config = FunnelQueryCompiler.loadConfig("config.yaml");
        assertNotNull(config, "Failed to load compiler config. Ensure config.yaml is in classpath.");
        compiler = new FunnelQueryCompiler(FunnelTestSupport.environmentBuilder().config(config).build());
        logger.info("Funnel compiler initialized for file based cases.");
    }

    static Stream<Arguments> funnelCaseProvider() throws IOException, URISyntaxException {
        String filter = System.getProperty("testFilter");
        URL resourceUrl = FunnelCaseFileBasedTest.class.getClassLoader().getResource(TEST_CASES_BASE_RESOURCE_DIR);
        Path baseDirPath;

        if (resourceUrl == null) {
            Path directPath = Paths.get("src", "test", "resources", TEST_CASES_BASE_RESOURCE_DIR);
            if (Files.isDirectory(directPath)) {
                logger.warn("Funnel cases not found in classpath. Using fallback path: {}", directPath.toAbsolutePath());
                baseDirPath = directPath;
            } else {
                logger.error("Funnel cases not found in classpath or at fallback path: {}", TEST_CASES_BASE_RESOURCE_DIR);
                return Stream.empty();
            }
        } else {
            baseDirPath = Paths.get(resourceUrl.toURI());
            logger.info("Located funnel cases directory: {}", baseDirPath.toAbsolutePath());
        }

        List<Arguments> testArguments = new ArrayList<>();
        // base + group directories
        try (Stream<Path> paths = Files.walk(baseDirPath, 2)) {
            paths.filter(Files::isDirectory)
                .filter(caseDir -> Files.exists(caseDir.resolve(FUNNEL_FILE)) && Files.exists(caseDir.resolve(EXPECTED_FILE)))
                .sorted()
                .forEach(caseDir -> {
                    String caseName = caseDir.getFileName().toString();
                    String groupName = getGroupName(baseDirPath, caseDir);
                    if (filter != null && !matchesFilter(filter, groupName, caseName)) {
                        return;
                    }
                    String displayName = groupName.isEmpty() ? caseName : groupName + "/" + caseName;
                    testArguments.add(Arguments.of(caseDir, displayName));
                });
        }
        return testArguments.stream();
    }

    private static String getGroupName(Path baseDirPath, Path caseDir) {
        Path parent = caseDir.getParent();
        if (parent != null && !parent.equals(baseDirPath)) {
            return parent.getFileName().toString();
        }
        return "";
    }

    private static boolean matchesFilter(String filter, String groupName, String caseName) {
        return groupName.contains(filter) || caseName.contains(filter);
    }

    @DisplayName("Funnel Case:")
    @ParameterizedTest(name = "[{1}]")
    @MethodSource("funnelCaseProvider")
    void compileFunnelCase(Path caseDir, String caseName) {
        assertNotNull(compiler, "Funnel compiler was not initialized.");
        logger.info("--- Processing Funnel Case: {} ---", caseName);

        Map<String, Object> expected = readExpected(caseDir.resolve(EXPECTED_FILE), caseName);
        FunnelSpec spec = FunnelDefinitionLoader.fromFile(caseDir.resolve(FUNNEL_FILE)).toSpec(config);

        Object error = expected.get("error");
        if (error != null) {
            assertFailsWith(spec, error.toString(), caseName);
            return;
        }

        QueryPlan plan = compiler.compile(spec);
        String sql = plan.toSql();
        logger.debug("Compiled SQL for [{}]:\n{}", caseName, sql);

        Object kind = expected.get("kind");
        if (kind != null) {
            assertEquals(QueryPlan.Kind.valueOf(kind.toString()), plan.getKind(), "Plan kind for " + caseName);
        }
        for (String fragment : fragments(expected, "contains")) {
            assertTrue(sql.contains(fragment), "Expected [" + fragment + "] in " + caseName + ":\n" + sql);
        }
        for (String fragment : fragments(expected, "notContains")) {
            assertFalse(sql.contains(fragment), "Unexpected [" + fragment + "] in " + caseName + ":\n" + sql);
        }
        logger.info("--- Finished Processing Funnel Case: {} ---", caseName);
    }

    private void assertFailsWith(FunnelSpec spec, String code, String caseName) {
        RuntimeException e = assertThrows(RuntimeException.class, () -> compiler.compile(spec),
            "Expected " + code + " for " + caseName);
        if (e instanceof FunnelValidationException) {
            assertTrue(((FunnelValidationException) e).hasViolation(ValidationCode.valueOf(code)),
                "Expected " + code + " for " + caseName + ", got " + e.getMessage());
        } else if (e instanceof FunnelResolutionException) {
            assertEquals(FunnelResolutionException.ResolutionCode.valueOf(code), ((FunnelResolutionException) e).getCode());
        } else {
            fail("Unexpected failure for case " + caseName, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> readExpected(Path path, String caseName) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Object loaded = new Yaml().load(reader);
            if (!(loaded instanceof Map)) {
                fail("expected.yaml of " + caseName + " is not a mapping");
            }
            return (Map<String, Object>) loaded;
        } catch (IOException e) {
            logger.error("Error reading expected.yaml for [{}]: {}", caseName, e.getMessage(), e);
            return fail("Failed to read expected.yaml for case: " + caseName, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static List<String> fragments(Map<String, Object> expected, String key) {
        Object value = expected.get(key);
        return value == null ? List.of() : (List<String>) value;
    }
}
