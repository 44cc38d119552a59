package com.numeval.expr.parser;

import java.util.ArrayList;
import java.util.List;

import com.numeval.expr.parser.Operand.Call;
import com.numeval.expr.parser.Operand.Constant;
import com.numeval.expr.parser.Operand.OperandInterface;
import com.numeval.expr.parser.Operand.Unary;
import com.numeval.expr.parser.Operand.Variable;

/**
 * Builds a flattened {@link Expression} from tokens. Precedence is not
 * decided here; the parser only alternates operands and operators and
 * leaves grouping to the reducer.
 *
 *   expression := value (binop value)*
 *   value      := NUMBER
 *               | IDENTIFIER
 *               | IDENTIFIER '(' [expression (',' expression)*] ')'
 *               | '(' expression ')'
 *               | ('-' | '+' | '!') value
 */
public class Parser {
    public static final int DEFAULT_MAX_DEPTH = 64;

    private final List<Token> tokens;
    private final int maxDepth;
    private int current = 0;
    private int depth = 0;

    public Parser(List<Token> tokens) { this(tokens, DEFAULT_MAX_DEPTH); }

    public Parser(List<Token> tokens, int maxDepth) {
        this.tokens = tokens;
        this.maxDepth = maxDepth;
    }

    public Expression parse() {
        if (isAtEnd()) throw error(peek(), "Empty expression.");
        Expression expr = expression();
        if (!isAtEnd()) throw error(peek(), "Unexpected '" + peek().lexeme + "' after expression.");
        return expr;
    }

    private Expression expression() {
        List<Expression.Tok> toks = new ArrayList<>();
        toks.add(Expression.value(value()));
        while (true) {
            BinaryOp op = binaryOp(peek().type);
            if (op == null) break;
            advance();
            toks.add(Expression.op(op));
            toks.add(Expression.value(value()));
        }
        return new Expression(toks);
    }

    private OperandInterface value() {
        enter();
        try {
            if (match(TokenType.NUMBER)) {
                return new Constant((Double) previous().literal);
            }
            if (match(TokenType.MINUS)) return new Unary(Unary.Op.NEG, value());
            if (match(TokenType.PLUS)) return new Unary(Unary.Op.POS, value());
            if (match(TokenType.BANG)) return new Unary(Unary.Op.NOT, value());

            if (match(TokenType.IDENTIFIER)) {
                Token name = previous();
                if (match(TokenType.LEFT_PAREN)) return call(name);
                return new Variable(name.lexeme);
            }

            if (match(TokenType.LEFT_PAREN)) {
                Expression inner = expression();
                consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
                return inner;
            }

            throw error(peek(), isAtEnd() ? "Expect value at end of input." : "Expect value, got '" + peek().lexeme + "'.");
        } finally {
            depth--;
        }
    }

    private Call call(Token name) {
        List<Expression> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                args.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments to " + name.lexeme + ".");
        return new Call(name.lexeme, args);
    }

    private void enter() {
        if (++depth > maxDepth) {
            depth--;
            throw error(peek(), "Expression nesting too deep (max " + maxDepth + ").");
        }
    }

    private static BinaryOp binaryOp(TokenType type) {
        switch (type) {
            case PLUS: return BinaryOp.PLUS;
            case MINUS: return BinaryOp.MINUS;
            case STAR: return BinaryOp.MUL;
            case SLASH: return BinaryOp.DIV;
            case PERCENT: return BinaryOp.MOD;
            case CARET: return BinaryOp.EXP;
            case LESS: return BinaryOp.LT;
            case LESS_EQUAL: return BinaryOp.LTE;
            case GREATER: return BinaryOp.GT;
            case GREATER_EQUAL: return BinaryOp.GTE;
            case EQUAL_EQUAL: return BinaryOp.EQ;
            case BANG_EQUAL: return BinaryOp.NE;
            case AND_AND: return BinaryOp.AND;
            case OR_OR: return BinaryOp.OR;
            default: return null;
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private EvalException error(Token token, String message) {
        return EvalException.parse("[col " + token.column + "] " + message);
    }
}
