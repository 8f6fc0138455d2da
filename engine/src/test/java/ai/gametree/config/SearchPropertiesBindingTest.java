package ai.gametree.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

/**
 * Binding of {@code search.*} properties, as they would come from {@code application.properties}
 * or the command line.
 */
class SearchPropertiesBindingTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(SearchProperties.class);

    @Test
    void defaultsApplyWithoutProperties() {
        contextRunner.run(context -> {
            SearchProperties properties = context.getBean(SearchProperties.class);
            assertEquals(0.0, properties.getTimeLimit());
            assertEquals(100, properties.getNodeLimit());
            assertEquals(5, properties.getSearchDepth());
            assertFalse(properties.isDebug());
            assertEquals(SearchProperties.Expansion.FORWARD_SWEEP, properties.getExpansion());
            assertEquals(SearchProperties.Strategy.ONE_STEP, properties.getStrategy());
            assertEquals(SearchProperties.Selection.RANDOM_BEST, properties.getSelection());
            assertTrue(properties.isPruning());
            assertNull(properties.getSeed());
        });
    }

    @Test
    void relaxedNamesAndEnumsBind() {
        contextRunner
                .withPropertyValues(
                        "search.time-limit=0.25",
                        "search.node-limit=0",
                        "search.search-depth=3",
                        "search.debug=true",
                        "search.expansion=full",
                        "search.strategy=current-node",
                        "search.selection=first",
                        "search.pruning=false",
                        "search.seed=12")
                .run(context -> {
                    SearchProperties properties = context.getBean(SearchProperties.class);
                    assertEquals(0.25, properties.getTimeLimit());
                    assertEquals(0, properties.getNodeLimit());
                    assertEquals(3, properties.getSearchDepth());
                    assertTrue(properties.isDebug());
                    assertEquals(SearchProperties.Expansion.FULL, properties.getExpansion());
                    assertEquals(SearchProperties.Strategy.CURRENT_NODE, properties.getStrategy());
                    assertEquals(SearchProperties.Selection.FIRST, properties.getSelection());
                    assertFalse(properties.isPruning());
                    assertEquals(12L, properties.getSeed());
                    assertTrue(properties.isBounded());
                });
    }
}
