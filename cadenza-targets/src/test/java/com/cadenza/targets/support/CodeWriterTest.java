package com.cadenza.targets.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CodeWriter 测试")
class CodeWriterTest {

    @Test
    @DisplayName("K&R 风格块与 else 接续")
    void testSameLineBraces() {
        CodeWriter w = new CodeWriter("  ");
        w.openBlock("if (a)");
        w.line("x();");
        w.continueBlock("else");
        w.line("y();");
        w.closeBlock("}");
        assertThat(w.getOutput()).isEqualTo("if (a) {\n  x();\n} else {\n  y();\n}\n");
    }

    @Test
    @DisplayName("Allman 风格块")
    void testBraceOnNewLine() {
        CodeWriter w = new CodeWriter("    ", true);
        w.openBlock("if (a)");
        w.line("x();");
        w.continueBlock("else");
        w.line("y();");
        w.closeBlock("}");
        assertThat(w.getOutput()).isEqualTo("if (a)\n{\n    x();\n}\nelse\n{\n    y();\n}\n");
    }

    @Test
    @DisplayName("空块头只输出花括号")
    void testEmptyHeader() {
        CodeWriter w = new CodeWriter("\t");
        w.openBlock("");
        w.line("z;");
        w.closeBlock("}");
        assertThat(w.getOutput()).isEqualTo("{\n\tz;\n}\n");
    }

    @Test
    @DisplayName("不产生连续空行，开头也不产生空行")
    void testBlankLines() {
        CodeWriter w = new CodeWriter("  ");
        w.blankLine();
        w.line("a");
        w.blankLine();
        w.blankLine();
        w.line("b");
        assertThat(w.getOutput()).isEqualTo("a\n\nb\n");
    }

    @Test
    @DisplayName("多行文本按当前缩进对齐，空行不加缩进")
    void testLines() {
        CodeWriter w = new CodeWriter("  ");
        w.indent();
        w.lines("one\n\ntwo");
        assertThat(w.getOutput()).isEqualTo("  one\n\n  two\n");
    }

    @Test
    @DisplayName("缩进层级不会小于零")
    void testDedentFloor() {
        CodeWriter w = new CodeWriter("  ");
        w.dedent();
        assertThat(w.getIndentLevel()).isZero();
        w.line("x");
        assertThat(w.getOutput()).isEqualTo("x\n");
    }
}
