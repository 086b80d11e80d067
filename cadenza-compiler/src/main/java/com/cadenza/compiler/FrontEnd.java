package com.cadenza.compiler;

import com.cadenza.compiler.analysis.AnalyzedProgram;
import com.cadenza.compiler.analysis.SemanticAnalyzer;
import com.cadenza.compiler.ast.decl.Program;
import com.cadenza.compiler.lexer.Lexer;
import com.cadenza.compiler.lexer.Token;
import com.cadenza.compiler.parser.Parser;

import java.util.List;

/**
 * 前端入口：词法 → 语法 → 语义分析，严格顺序执行，任一阶段失败即抛出
 */
public final class FrontEnd {

    private FrontEnd() {}

    /**
     * 词法 + 语法分析
     *
     * @param source   源码
     * @param fileName 文件名（用于诊断位置）
     */
    public static Program parse(String source, String fileName) {
        List<Token> tokens = new Lexer(source).tokenize();
        return new Parser(tokens, fileName).parse();
    }

    /**
     * 完整前端：解析并做语义分析，结果可交给任意数量的后端
     */
    public static AnalyzedProgram analyze(String source, String fileName) {
        return new SemanticAnalyzer().analyze(parse(source, fileName));
    }
}
