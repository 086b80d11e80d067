package com.cadenza.compiler.parser;

import com.cadenza.compiler.ast.TypeRef;
import com.cadenza.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.cadenza.compiler.lexer.TokenType.*;

/**
 * 类型解析辅助类
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    TypeRef parseType() {
        Token nameToken = parser.current();
        String name;
        if (parser.match(KW_RESULT)) {
            name = TypeRef.RESULT;
        } else if (parser.match(KW_OPTION)) {
            name = TypeRef.OPTION;
        } else if (parser.checkName()) {
            name = parser.advance().getLexeme();
        } else {
            throw new ParseException("Expected type", nameToken, "type name");
        }

        List<TypeRef> args = new ArrayList<TypeRef>();
        if (parser.match(LT)) {
            do {
                args.add(parseType());
            } while (parser.match(COMMA));
            parser.expect(GT, "Expected '>' after type arguments");
        }

        checkArity(name, args.size(), nameToken);
        return new TypeRef(name, args);
    }

    private void checkArity(String name, int count, Token at) {
        if (TypeRef.RESULT.equals(name) && count != 2) {
            throw new ParseException("Result type requires exactly 2 type arguments, got " + count,
                    at, "Result<T, E>");
        }
        if ((TypeRef.OPTION.equals(name) || TypeRef.LIST.equals(name)) && count != 1) {
            throw new ParseException(name + " type requires exactly 1 type argument, got " + count,
                    at, name + "<T>");
        }
    }
}
