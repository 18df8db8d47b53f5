package com.pyastng.compiler.ast;

import com.pyastng.compiler.ast.decl.*;
import com.pyastng.compiler.ast.expr.*;
import com.pyastng.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitModuleDecl(ModuleDecl node, C ctx) { return null; }

    default R visitClassDecl(ClassDecl node, C ctx) { return null; }

    default R visitFunctionDecl(FunctionDecl node, C ctx) { return null; }

    default R visitArguments(Arguments node, C ctx) { return null; }

    default R visitDecorators(Decorators node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitAssignStmt(AssignStmt node, C ctx) { return null; }

    default R visitAugAssignStmt(AugAssignStmt node, C ctx) { return null; }

    default R visitDeleteStmt(DeleteStmt node, C ctx) { return null; }

    default R visitExprStmt(ExprStmt node, C ctx) { return null; }

    default R visitPassStmt(PassStmt node, C ctx) { return null; }

    default R visitBreakStmt(BreakStmt node, C ctx) { return null; }

    default R visitContinueStmt(ContinueStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitRaiseStmt(RaiseStmt node, C ctx) { return null; }

    default R visitAssertStmt(AssertStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitForStmt(ForStmt node, C ctx) { return null; }

    default R visitWhileStmt(WhileStmt node, C ctx) { return null; }

    default R visitTryExceptStmt(TryExceptStmt node, C ctx) { return null; }

    default R visitExceptHandler(ExceptHandler node, C ctx) { return null; }

    default R visitTryFinallyStmt(TryFinallyStmt node, C ctx) { return null; }

    default R visitWithStmt(WithStmt node, C ctx) { return null; }

    default R visitImportStmt(ImportStmt node, C ctx) { return null; }

    default R visitFromImportStmt(FromImportStmt node, C ctx) { return null; }

    default R visitGlobalStmt(GlobalStmt node, C ctx) { return null; }

    default R visitExecStmt(ExecStmt node, C ctx) { return null; }

    default R visitPrintStmt(PrintStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitName(Name node, C ctx) { return null; }

    default R visitAssignName(AssignName node, C ctx) { return null; }

    default R visitDeleteName(DeleteName node, C ctx) { return null; }

    default R visitAttribute(Attribute node, C ctx) { return null; }

    default R visitAssignAttr(AssignAttr node, C ctx) { return null; }

    default R visitDeleteAttr(DeleteAttr node, C ctx) { return null; }

    default R visitConst(Const node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitBoolExpr(BoolExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitCompareExpr(CompareExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitKeyword(Keyword node, C ctx) { return null; }

    default R visitSubscriptExpr(SubscriptExpr node, C ctx) { return null; }

    default R visitIndexSlice(IndexSlice node, C ctx) { return null; }

    default R visitSliceExpr(SliceExpr node, C ctx) { return null; }

    default R visitExtSliceExpr(ExtSliceExpr node, C ctx) { return null; }

    default R visitEllipsisExpr(EllipsisExpr node, C ctx) { return null; }

    default R visitIfExpr(IfExpr node, C ctx) { return null; }

    default R visitListExpr(ListExpr node, C ctx) { return null; }

    default R visitTupleExpr(TupleExpr node, C ctx) { return null; }

    default R visitSetExpr(SetExpr node, C ctx) { return null; }

    default R visitDictExpr(DictExpr node, C ctx) { return null; }

    default R visitListCompExpr(ListCompExpr node, C ctx) { return null; }

    default R visitGeneratorExpr(GeneratorExpr node, C ctx) { return null; }

    default R visitSetCompExpr(SetCompExpr node, C ctx) { return null; }

    default R visitDictCompExpr(DictCompExpr node, C ctx) { return null; }

    default R visitComprehension(Comprehension node, C ctx) { return null; }

    default R visitYieldExpr(YieldExpr node, C ctx) { return null; }

    default R visitBackquoteExpr(BackquoteExpr node, C ctx) { return null; }

    default R visitLambdaExpr(LambdaExpr node, C ctx) { return null; }

    default R visitEmptyNode(EmptyNode node, C ctx) { return null; }
}
