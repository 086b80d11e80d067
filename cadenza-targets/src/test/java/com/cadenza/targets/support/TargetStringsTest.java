package com.cadenza.targets.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TargetStrings 测试")
class TargetStringsTest {

    @Test
    @DisplayName("C 系字符串转义")
    void testEscapeString() {
        assertThat(TargetStrings.quote("a\"b\\c\n")).isEqualTo("\"a\\\"b\\\\c\\n\"");
        assertThat(TargetStrings.escapeString("\u0001")).isEqualTo("\\u0001");
    }

    @Test
    @DisplayName("C# 插值文本段双写花括号")
    void testCSharpInterpolated() {
        assertThat(TargetStrings.escapeCSharpInterpolated("{x}")).isEqualTo("{{x}}");
    }

    @Test
    @DisplayName("模板字符串转义反引号和 $")
    void testTemplateLiteral() {
        assertThat(TargetStrings.escapeTemplateLiteral("`${a}`")).isEqualTo("\\`\\${a}\\`");
        assertThat(TargetStrings.escapeTemplateLiteral("line\nbreak")).isEqualTo("line\nbreak");
    }

    @Test
    @DisplayName("C++ 控制字符用八进制")
    void testCpp() {
        assertThat(TargetStrings.escapeCpp("\u0000" + "1")).isEqualTo("\\0001");
        assertThat(TargetStrings.escapeCpp("tab\t")).isEqualTo("tab\\t");
    }

    @Test
    @DisplayName("WAT 字符串按 UTF-8 字节转义")
    void testWat() {
        assertThat(TargetStrings.escapeWat("a\"é")).isEqualTo("a\\22\\c3\\a9");
        assertThat(TargetStrings.escapeWat("x\n")).isEqualTo("x\\0a");
    }
}
