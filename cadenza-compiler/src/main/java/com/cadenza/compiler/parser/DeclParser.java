package com.cadenza.compiler.parser;

import com.cadenza.compiler.ast.Effect;
import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.Statement;
import com.cadenza.compiler.ast.TypeRef;
import com.cadenza.compiler.ast.decl.*;
import com.cadenza.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.cadenza.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 顶层声明：[spec] function / pure function / export ... / module / import
     */
    Statement parseTopLevel() {
        SpecificationBlock spec = parseSpecificationBlock();

        if (parser.check(KW_MODULE)) {
            return parseModule(spec);
        }
        if (parser.checkAny(KW_FUNCTION, KW_PURE)) {
            return parseFunction(spec, false);
        }
        if (isExportedFunction()) {
            parser.advance();
            return parseFunction(spec, true);
        }
        if (spec != null) {
            throw new ParseException("Specification block must be followed by a function or module declaration",
                    parser.current());
        }
        if (parser.check(KW_IMPORT)) {
            return parseImport();
        }
        if (parser.check(KW_EXPORT)) {
            return parseExport(null);
        }
        throw new ParseException("Expected declaration", parser.current(), "function, module, import or export");
    }

    private boolean isExportedFunction() {
        return parser.check(KW_EXPORT) && parser.peek(1).isOneOf(KW_FUNCTION, KW_PURE);
    }

    // ============ 函数 ============

    /**
     * [pure] function name(params) [uses [E, ...]] [-> Type] { body }
     */
    FunctionDeclaration parseFunction(SpecificationBlock spec, boolean exported) {
        SourceLocation loc = parser.location();
        boolean pure = parser.match(KW_PURE);
        parser.expect(KW_FUNCTION, "Expected 'function'");
        Token nameToken = parser.current();
        String name = parser.expectName("Expected function name");

        parser.expect(LPAREN, "Expected '(' after function name");
        List<Parameter> params = new ArrayList<Parameter>();
        if (!parser.check(RPAREN)) {
            do {
                SourceLocation paramLoc = parser.location();
                String paramName = parser.expect(IDENTIFIER, "Expected parameter name").getLexeme();
                parser.expect(COLON, "Expected ':' after parameter name");
                params.add(new Parameter(paramLoc, paramName, parser.parseType()));
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after parameters");

        // uses 子句可以写在返回类型前或后
        List<Effect> effects = null;
        if (parser.check(KW_USES)) {
            effects = parseEffects(pure, name);
        }
        TypeRef returnType = TypeRef.UNIT_TYPE;
        if (parser.match(ARROW)) {
            returnType = parser.parseType();
        }
        if (parser.check(KW_USES)) {
            if (effects != null) {
                throw new ParseException("Duplicate 'uses' clause on function '" + name + "'", parser.current());
            }
            effects = parseEffects(pure, name);
        }

        if (!parser.check(LBRACE)) {
            throw new ParseException("Missing body for function '" + name + "'", parser.current(), "{");
        }
        List<Statement> body = parser.parseBlock();

        if (effects == null) {
            effects = new ArrayList<Effect>();
        }
        if (pure && !effects.isEmpty()) {
            throw new ParseException("Pure function '" + name + "' cannot declare effects", nameToken);
        }
        return new FunctionDeclaration(loc, name, params, returnType, body, pure, effects, exported, spec);
    }

    /**
     * uses [A, B]：名字必须属于封闭副作用词汇表，不允许重复
     */
    private List<Effect> parseEffects(boolean pure, String functionName) {
        Token usesToken = parser.expect(KW_USES, "Expected 'uses'");
        if (pure) {
            throw new ParseException("Pure function '" + functionName + "' cannot declare effects", usesToken);
        }
        parser.expect(LBRACKET, "Expected '[' after 'uses'");
        Set<Effect> effects = new LinkedHashSet<Effect>();
        if (parser.check(RBRACKET)) {
            throw new ParseException("Effect list cannot be empty", parser.current(), "effect name");
        }
        do {
            Token token = parser.current();
            if (token.is(EFFECT)) {
                parser.advance();
                Effect effect = (Effect) token.getLiteral();
                if (!effects.add(effect)) {
                    throw new ParseException("Duplicate effect '" + effect.getDisplayName() + "'", token);
                }
            } else if (token.is(IDENTIFIER)) {
                throw new ParseException("Unknown effect '" + token.getLexeme() + "'", token, knownEffects());
            } else {
                throw new ParseException("Expected effect name", token, knownEffects());
            }
        } while (parser.match(COMMA));
        parser.expect(RBRACKET, "Expected ']' after effect list");
        return new ArrayList<Effect>(effects);
    }

    private static String knownEffects() {
        StringBuilder sb = new StringBuilder();
        for (Effect e : Effect.values()) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(e.getDisplayName());
        }
        return sb.toString();
    }

    // ============ 模块 ============

    /**
     * module Name { functions, imports, exports }
     */
    private ModuleDeclaration parseModule(SpecificationBlock spec) {
        SourceLocation loc = parser.location();
        parser.expect(KW_MODULE, "Expected 'module'");
        String name = parser.expectName("Expected module name");
        parser.expect(LBRACE, "Expected '{' after module name");

        List<Statement> body = new ArrayList<Statement>();
        Set<String> exports = null;
        parser.skipSemicolons();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SpecificationBlock memberSpec = parseSpecificationBlock();
            Statement member;
            if (parser.checkAny(KW_FUNCTION, KW_PURE)) {
                member = parseFunction(memberSpec, false);
            } else if (isExportedFunction()) {
                parser.advance();
                member = parseFunction(memberSpec, true);
            } else if (memberSpec != null) {
                throw new ParseException("Specification block must be followed by a function declaration",
                        parser.current());
            } else if (parser.check(KW_EXPORT)) {
                member = parseExport(name);
            } else if (parser.check(KW_IMPORT)) {
                member = parseImport();
            } else if (parser.check(KW_MODULE)) {
                throw new ParseException("Nested modules are not supported", parser.current());
            } else {
                throw new ParseException("Expected function, import or export in module '" + name + "'",
                        parser.current());
            }

            if (member instanceof ExportStatement) {
                if (exports == null) exports = new LinkedHashSet<String>();
                exports.addAll(((ExportStatement) member).getNames());
            } else if (member instanceof FunctionDeclaration && ((FunctionDeclaration) member).isExported()) {
                if (exports == null) exports = new LinkedHashSet<String>();
                exports.add(((FunctionDeclaration) member).getName());
            }
            body.add(member);
            parser.skipSemicolons();
        }
        parser.expect(RBRACE, "Expected '}' after module body");
        return new ModuleDeclaration(loc, name, body, exports, spec);
    }

    // ============ 导入导出 ============

    /**
     * import M.{a, b} | import M.* | import {a, b} from M | import M
     */
    private ImportStatement parseImport() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IMPORT, "Expected 'import'");

        if (parser.check(LBRACE)) {
            List<String> names = parseNameList();
            parser.expect(KW_FROM, "Expected 'from' after import list");
            String module = parseModulePath();
            return new ImportStatement(loc, module, names, false);
        }

        StringBuilder module = new StringBuilder(parser.expectName("Expected module name after 'import'"));
        while (parser.match(DOT)) {
            if (parser.match(MUL)) {
                return new ImportStatement(loc, module.toString(), new ArrayList<String>(), true);
            }
            if (parser.check(LBRACE)) {
                List<String> names = parseNameList();
                return new ImportStatement(loc, module.toString(), names, false);
            }
            module.append('.').append(parser.expectName("Expected name after '.' in import"));
        }
        return new ImportStatement(loc, module.toString(), new ArrayList<String>(), false);
    }

    private String parseModulePath() {
        StringBuilder module = new StringBuilder(parser.expectName("Expected module name"));
        while (parser.match(DOT)) {
            module.append('.').append(parser.expectName("Expected name after '.'"));
        }
        return module.toString();
    }

    /** { a, b, c } */
    private List<String> parseNameList() {
        parser.expect(LBRACE, "Expected '{'");
        List<String> names = new ArrayList<String>();
        do {
            names.add(parser.expectName("Expected name"));
        } while (parser.match(COMMA));
        parser.expect(RBRACE, "Expected '}' after names");
        return names;
    }

    /**
     * export { a, b } | export a, b（export function 由调用方先行识别）
     *
     * @param moduleName 所在模块，顶层为 null
     */
    private Statement parseExport(String moduleName) {
        SourceLocation loc = parser.location();
        parser.expect(KW_EXPORT, "Expected 'export'");

        if (parser.check(LBRACE)) {
            return new ExportStatement(loc, parseNameList());
        }
        List<String> names = new ArrayList<String>();
        do {
            names.add(parser.expectName(moduleName == null
                    ? "Expected name after 'export'"
                    : "Expected name after 'export' in module '" + moduleName + "'"));
        } while (parser.match(COMMA));
        return new ExportStatement(loc, names);
    }

    // ============ 规约块 ============

    /**
     * 解析 /*spec ... spec*&#47; 内容：intent（必填）、rules、postconditions、source_doc
     */
    private SpecificationBlock parseSpecificationBlock() {
        if (!parser.check(SPEC_BLOCK)) {
            return null;
        }
        Token token = parser.advance();
        String content = (String) token.getLiteral();

        String intent = null;
        List<String> rules = new ArrayList<String>();
        List<String> postconditions = new ArrayList<String>();
        String sourceDoc = null;
        String section = null;

        for (String raw : content.split("\n")) {
            String line = raw.trim();
            if (line.isEmpty()) continue;

            if (line.startsWith("intent:")) {
                intent = unquote(line.substring("intent:".length()));
                section = "intent";
            } else if (line.startsWith("rules:")) {
                section = "rules";
            } else if (line.startsWith("postconditions:")) {
                section = "postconditions";
            } else if (line.startsWith("source_doc:")) {
                sourceDoc = unquote(line.substring("source_doc:".length()));
                section = "source_doc";
            } else if (line.startsWith("- ")) {
                String item = unquote(line.substring(2));
                if ("rules".equals(section)) {
                    rules.add(item);
                } else if ("postconditions".equals(section)) {
                    postconditions.add(item);
                }
            }
        }

        if (intent == null || intent.isEmpty()) {
            throw new ParseException("Specification block missing required 'intent' field", token);
        }
        return new SpecificationBlock(intent, rules, postconditions, sourceDoc);
    }

    private static String unquote(String value) {
        String v = value.trim();
        if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) {
            v = v.substring(1, v.length() - 1);
        }
        return v;
    }
}
