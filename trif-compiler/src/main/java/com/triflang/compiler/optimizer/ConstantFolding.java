package com.triflang.compiler.optimizer;

import com.triflang.compiler.ast.AstNode;
import com.triflang.compiler.ast.Program;
import com.triflang.compiler.ast.SourceLocation;
import com.triflang.compiler.ast.expr.*;
import com.triflang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.triflang.compiler.ast.expr.UnaryExpr.UnaryOp;

/**
 * 字面量常量折叠。
 * 自底向上：子表达式先折叠，再尝试折叠父节点。
 *
 * <ul>
 *   <li>数字 {@code + - *}；除法仅在除数非零时折叠</li>
 *   <li>字符串 {@code +} 拼接</li>
 *   <li>{@code -数字}、{@code !布尔}</li>
 * </ul>
 * 取模、比较、逻辑运算保持原样；标识符不做常量传播。
 */
public class ConstantFolding extends AstTransformer implements AstPass {

    @Override
    public String getName() {
        return "ConstantFolding";
    }

    @Override
    public Program run(Program program) {
        return transform(program);
    }

    @Override
    public AstNode visitBinaryExpr(BinaryExpr node, Void ctx) {
        AstNode result = super.visitBinaryExpr(node, ctx);
        Expression folded = tryFoldBinary((BinaryExpr) result);
        return folded != null ? folded : result;
    }

    @Override
    public AstNode visitUnaryExpr(UnaryExpr node, Void ctx) {
        AstNode result = super.visitUnaryExpr(node, ctx);
        Expression folded = tryFoldUnary((UnaryExpr) result);
        return folded != null ? folded : result;
    }

    private Expression tryFoldBinary(BinaryExpr expr) {
        Expression left = expr.getLeft();
        Expression right = expr.getRight();
        SourceLocation loc = expr.getLocation();

        if (left instanceof NumberLiteral && right instanceof NumberLiteral) {
            double l = ((NumberLiteral) left).getValue();
            double r = ((NumberLiteral) right).getValue();
            switch (expr.getOperator()) {
                case ADD: return new NumberLiteral(loc, l + r);
                case SUB: return new NumberLiteral(loc, l - r);
                case MUL: return new NumberLiteral(loc, l * r);
                case DIV:
                    if (r == 0.0) return null;
                    return new NumberLiteral(loc, l / r);
                default:
                    return null;
            }
        }

        // 字符串拼接
        if (expr.getOperator() == BinaryOp.ADD
                && left instanceof StringLiteral && right instanceof StringLiteral) {
            return new StringLiteral(loc,
                    ((StringLiteral) left).getValue() + ((StringLiteral) right).getValue());
        }
        return null;
    }

    private Expression tryFoldUnary(UnaryExpr expr) {
        Expression operand = expr.getOperand();
        if (expr.getOperator() == UnaryOp.NEG && operand instanceof NumberLiteral) {
            return new NumberLiteral(expr.getLocation(), -((NumberLiteral) operand).getValue());
        }
        if (expr.getOperator() == UnaryOp.NOT && operand instanceof BooleanLiteral) {
            return new BooleanLiteral(expr.getLocation(), !((BooleanLiteral) operand).getValue());
        }
        return null;
    }
}
