package io.github.yok.flexschema.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class InferenceConfigTest {

    @Configuration
    @EnableConfigurationProperties({InferenceConfig.class, ReaderConfig.class})
    static class TestConfig {
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(TestConfig.class);

    @Test
    void バインド_正常ケース_プロパティ未指定_既定値が使われること() {
        runner.run(context -> {
            InferenceConfig config = context.getBean(InferenceConfig.class);
            assertEquals(100, config.getSampleLimit());
            assertEquals(5, config.getPreviewSize());
            assertEquals(10, config.getMinStringLength());
            assertEquals(4000, config.getMaxStringLength());
        });
    }

    @Test
    void バインド_正常ケース_ケバブケースのプロパティ_各項目に反映されること() {
        runner.withPropertyValues("inference.sample-limit=50", "inference.preview-size=3",
                "inference.min-string-length=5", "inference.max-string-length=255",
                "reader.encoding=Shift_JIS", "reader.strip-carriage-return=false")
                .run(context -> {
                    InferenceConfig inference = context.getBean(InferenceConfig.class);
                    assertEquals(50, inference.getSampleLimit());
                    assertEquals(3, inference.getPreviewSize());
                    assertEquals(5, inference.getMinStringLength());
                    assertEquals(255, inference.getMaxStringLength());

                    ReaderConfig reader = context.getBean(ReaderConfig.class);
                    assertEquals("Shift_JIS", reader.getEncoding());
                    assertEquals(false, reader.isStripCarriageReturn());
                });
    }
}
