package com.cadenza.targets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TargetConfiguration 测试")
class TargetConfigurationTest {

    private static TargetConfiguration load(String resource) throws Exception {
        InputStream in = TargetConfigurationTest.class.getResourceAsStream(resource);
        assertThat(in).as(resource).isNotNull();
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return TargetConfiguration.fromJson(reader);
        }
    }

    @Nested
    @DisplayName("默认值")
    class DefaultTests {

        @Test
        @DisplayName("默认四个空格缩进，开启运行时检查")
        void testDefaults() {
            TargetConfiguration config = new TargetConfiguration();
            assertThat(config.getIndentString()).isEqualTo("    ");
            assertThat(config.isEnableRuntimeChecks()).isTrue();
            assertThat(config.isOptimizeForSpeed()).isTrue();
            assertThat(config.isOptimizeForSize()).isFalse();
            assertThat(config.getRuntimeVersion()).isEqualTo("latest");
        }

        @Test
        @DisplayName("制表符缩进")
        void testTabs() {
            TargetConfiguration config = new TargetConfiguration();
            config.setUseSpaces(false);
            assertThat(config.getIndentString()).isEqualTo("\t");
        }

        @Test
        @DisplayName("空值选项回落到默认值")
        void testOptionFallback() {
            TargetConfiguration config = new TargetConfiguration().setOption("java.package", "");
            assertThat(config.getOption("java.package", "cadenza.generated")).isEqualTo("cadenza.generated");
            assertThat(config.getOption("missing", "x")).isEqualTo("x");
        }
    }

    @Nested
    @DisplayName("JSON")
    class JsonTests {

        @Test
        @DisplayName("从资源文件加载，缺失的键保持默认，未知的键被忽略")
        void testLoadResource() throws Exception {
            TargetConfiguration config = load("/com/cadenza/targets/target-config.json");
            assertThat(config.isOptimizeForSize()).isTrue();
            assertThat(config.isIncludeDebugInfo()).isTrue();
            assertThat(config.getIndentSize()).isEqualTo(2);
            assertThat(config.getIndentString()).isEqualTo("  ");
            assertThat(config.isEnableRuntimeChecks()).isTrue();
            assertThat(config.isOptimizeForSpeed()).isTrue();
            assertThat(config.getOption("java.package", null)).isEqualTo("com.example.orders");
            assertThat(config.getTargetSpecificOptions()).hasSize(3);
        }

        @Test
        @DisplayName("写出后再读入保持一致")
        void testToJson() {
            TargetConfiguration config = new TargetConfiguration().setOption("cpp.standard", "20");
            config.setIndentSize(8);
            TargetConfiguration copy = TargetConfiguration.fromJson(new StringReader(config.toJson()));
            assertThat(copy.getIndentSize()).isEqualTo(8);
            assertThat(copy.getOption("cpp.standard", "17")).isEqualTo("20");
        }

        @Test
        @DisplayName("空文档得到默认配置")
        void testEmptyDocument() {
            TargetConfiguration config = TargetConfiguration.fromJson(new StringReader(""));
            assertThat(config.getIndentSize()).isEqualTo(4);
            assertThat(config.getTargetSpecificOptions()).isEmpty();
        }

        @Test
        @DisplayName("格式错误抛出 IllegalArgumentException")
        void testMalformed() {
            assertThatThrownBy(() -> TargetConfiguration.fromJson(new StringReader("{ \"indentSize\": ")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Invalid target configuration");
        }
    }
}
