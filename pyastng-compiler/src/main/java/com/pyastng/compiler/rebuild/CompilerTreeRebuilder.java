package com.pyastng.compiler.rebuild;

import com.pyastng.compiler.ast.AstNode;
import com.pyastng.compiler.ast.decl.Arguments;
import com.pyastng.compiler.ast.decl.ClassDecl;
import com.pyastng.compiler.ast.decl.Decorators;
import com.pyastng.compiler.ast.decl.FunctionBase;
import com.pyastng.compiler.ast.decl.FunctionDecl;
import com.pyastng.compiler.ast.decl.ModuleDecl;
import com.pyastng.compiler.ast.expr.*;
import com.pyastng.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pyastng.compiler.ast.expr.BoolExpr.BoolOp;
import com.pyastng.compiler.ast.expr.CompareExpr.CompareOp;
import com.pyastng.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.pyastng.compiler.ast.stmt.*;
import com.pyastng.compiler.builder.BuilderConfig;
import com.pyastng.compiler.builder.ModuleResolver;
import com.pyastng.compiler.parsetree.MalformedTreeException;
import com.pyastng.compiler.parsetree.RawNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code compiler} 包形状的解析树重建器
 *
 * <p>这种形状的特点：语句体包在 {@code Stmt} 中，赋值目标是独立的
 * {@code AssName}/{@code AssAttr}/{@code AssTuple}/{@code AssList}，语句位置上的这些节点表示 del；
 * 位运算是多元的，比较以 {@code (op, 节点)} 列表给出，关键字参数混在位置参数中。</p>
 */
public class CompilerTreeRebuilder extends TreeRebuilder {

    private static final Map<String, BinaryOp> BINARY_OPS = new HashMap<String, BinaryOp>();
    private static final Map<String, BinaryOp> BITWISE_OPS = new HashMap<String, BinaryOp>();
    private static final Map<String, UnaryOp> UNARY_OPS = new HashMap<String, UnaryOp>();

    static {
        BINARY_OPS.put("Add", BinaryOp.ADD);
        BINARY_OPS.put("Sub", BinaryOp.SUB);
        BINARY_OPS.put("Mul", BinaryOp.MUL);
        BINARY_OPS.put("Div", BinaryOp.DIV);
        BINARY_OPS.put("FloorDiv", BinaryOp.FLOOR_DIV);
        BINARY_OPS.put("Mod", BinaryOp.MOD);
        BINARY_OPS.put("Power", BinaryOp.POW);
        BINARY_OPS.put("LeftShift", BinaryOp.LSHIFT);
        BINARY_OPS.put("RightShift", BinaryOp.RSHIFT);
        BITWISE_OPS.put("Bitand", BinaryOp.BIT_AND);
        BITWISE_OPS.put("Bitor", BinaryOp.BIT_OR);
        BITWISE_OPS.put("Bitxor", BinaryOp.BIT_XOR);
        UNARY_OPS.put("UnaryAdd", UnaryOp.POS);
        UNARY_OPS.put("UnarySub", UnaryOp.NEG);
        UNARY_OPS.put("Not", UnaryOp.NOT);
        UNARY_OPS.put("Invert", UnaryOp.INVERT);
    }

    /** 参数标志位：存在 *args / **kwargs */
    private static final long CO_VARARGS = 4;
    private static final long CO_VARKEYWORDS = 8;

    public CompilerTreeRebuilder(ModuleResolver resolver, BuilderConfig config) {
        super(resolver, config);
    }

    @Override
    protected void rebuildModule(RawNode raw, ModuleDecl module) {
        module.setDoc(raw.getString("doc"));
        module.getBody().addAll(statements(stmtNodes(raw.getNode("node")), module));
    }

    @Override
    protected AstNode visit(RawNode raw, AstNode parent) {
        if (raw == null) {
            return null;
        }
        String type = raw.getType();
        if (BINARY_OPS.containsKey(type)) {
            BinaryExpr node = setInfos(raw, new BinaryExpr(BINARY_OPS.get(type)), parent);
            node.setLeft(expr(raw.getNode("left"), node));
            node.setRight(expr(raw.getNode("right"), node));
            return node;
        }
        if (BITWISE_OPS.containsKey(type)) {
            return visitBitwise(raw, parent);
        }
        if (UNARY_OPS.containsKey(type)) {
            UnaryExpr node = setInfos(raw, new UnaryExpr(UNARY_OPS.get(type)), parent);
            node.setOperand(expr(raw.getNode("expr"), node));
            return node;
        }
        switch (type) {
            // 语句
            case "Assign": return visitAssign(raw, parent);
            case "AugAssign": return visitAugAssign(raw, parent);
            case "Discard": return visitDiscard(raw, parent);
            case "Pass": return setInfos(raw, new PassStmt(), parent);
            case "Break": return setInfos(raw, new BreakStmt(), parent);
            case "Continue": return setInfos(raw, new ContinueStmt(), parent);
            case "Return": return visitReturn(raw, parent);
            case "Raise": return visitRaise(raw, parent);
            case "Assert": return visitAssert(raw, parent);
            case "If": return visitIf(raw, parent);
            case "For": return visitFor(raw, parent);
            case "While": return visitWhile(raw, parent);
            case "TryExcept": return visitTryExcept(raw, parent);
            case "TryFinally": return visitTryFinally(raw, parent);
            case "With": return visitWith(raw, parent);
            case "Import": return importStatement(raw, aliases(raw), parent);
            case "From":
                return fromImportStatement(raw, raw.getString("modname"), (int) raw.getLong("level", 0),
                        aliases(raw), parent);
            case "Global": return globalStatement(raw, strings(raw.getList("names")), parent);
            case "Exec": return visitExec(raw, parent);
            case "Print": return visitPrint(raw, parent, false);
            case "Printnl": return visitPrint(raw, parent, true);
            case "Class": return visitClass(raw, parent);
            case "Function": return visitFunction(raw, parent);

            // 赋值目标
            case "AssName": return nameNode(raw, raw.getString("name"), parent);
            case "AssAttr": return attributeNode(raw, raw.getNode("expr"), raw.getString("attrname"), parent);
            case "AssTuple": return visitAssSequence(raw, parent, new TupleExpr());
            case "AssList": return visitAssSequence(raw, parent, new ListExpr());

            // 表达式
            case "Name": return visitName(raw, parent);
            case "Getattr": return visitGetattr(raw, parent);
            case "Const": return setInfos(raw, new Const(raw.get("value")), parent);
            case "CallFunc": return visitCallFunc(raw, parent);
            case "Compare": return visitCompare(raw, parent);
            case "And": return visitBoolOp(raw, parent, BoolOp.AND);
            case "Or": return visitBoolOp(raw, parent, BoolOp.OR);
            case "Subscript": return visitSubscript(raw, parent);
            case "Slice": return visitSlice(raw, parent);
            case "Sliceobj": return visitSliceobj(raw, parent);
            case "Ellipsis": return setInfos(raw, new EllipsisExpr(), parent);
            case "Tuple": return visitSequence(raw, parent, new TupleExpr());
            case "List": return visitSequence(raw, parent, new ListExpr());
            case "Set": return visitSequence(raw, parent, new SetExpr());
            case "Dict": return visitDict(raw, parent);
            case "ListComp": return visitListComp(raw, parent);
            case "GenExpr": return visitGenExpr(raw, parent);
            case "SetComp": return visitSetComp(raw, parent);
            case "DictComp": return visitDictComp(raw, parent);
            case "Yield": return visitYield(raw, parent);
            case "Backquote": {
                BackquoteExpr node = setInfos(raw, new BackquoteExpr(), parent);
                node.setValue(expr(raw.getNode("expr"), node));
                return node;
            }
            case "IfExp": return visitIfExp(raw, parent);
            case "Lambda": return visitLambda(raw, parent);
            case "Keyword": return visitKeyword(raw, parent);
            case "EmptyNode": return unknownNode(raw, parent);
            default: return unknownNode(raw, parent);
        }
    }

    // ============ 语句 ============

    private AstNode visitAssign(RawNode raw, AstNode parent) {
        AssignStmt node = setInfos(raw, new AssignStmt(), parent);
        for (RawNode target : raw.getNodes("nodes")) {
            node.getTargets().add(visitIn(AssignContext.ASSIGN, target, node));
        }
        node.setValue(expr(raw.getNode("expr"), node));
        setAssignInfos(node);
        return node;
    }

    private AstNode visitAugAssign(RawNode raw, AstNode parent) {
        AugAssignStmt node = setInfos(raw, new AugAssignStmt(), parent);
        node.setTarget(visitIn(AssignContext.AUG_ASSIGN, raw.getNode("node"), node));
        String op = raw.getString("op");
        node.setOperator(BinaryOp.fromSymbol(op.endsWith("=") ? op.substring(0, op.length() - 1) : op));
        node.setValue(expr(raw.getNode("expr"), node));
        return node;
    }

    /** 分号结尾引入的无行号空语句被剪除 */
    private AstNode visitDiscard(RawNode raw, AstNode parent) {
        if (raw.getLineno() == null) {
            return null;
        }
        ExprStmt node = setInfos(raw, new ExprStmt(), parent);
        node.setValue(expr(raw.getNode("expr"), node));
        return node;
    }

    private AstNode visitReturn(RawNode raw, AstNode parent) {
        ReturnStmt node = setInfos(raw, new ReturnStmt(), parent);
        node.setValue(expr(filterNone(raw.getNode("value")), node));
        return node;
    }

    private AstNode visitRaise(RawNode raw, AstNode parent) {
        RaiseStmt node = setInfos(raw, new RaiseStmt(), parent);
        node.setExceptionType(expr(raw.getNode("expr1"), node));
        node.setExceptionValue(expr(raw.getNode("expr2"), node));
        node.setTraceback(expr(raw.getNode("expr3"), node));
        return node;
    }

    private AstNode visitAssert(RawNode raw, AstNode parent) {
        AssertStmt node = setInfos(raw, new AssertStmt(), parent);
        node.setTest(expr(raw.getNode("test"), node));
        node.setFail(expr(raw.getNode("fail"), node));
        return node;
    }

    /** if/elif/else 规范化为嵌套的 if 链；每个 elif 链接使用自己的行范围 */
    private AstNode visitIf(RawNode raw, AstNode parent) {
        List<Object> tests = raw.getList("tests");
        if (tests.isEmpty()) {
            throw new MalformedTreeException("If 节点没有条件分支");
        }
        IfStmt root = setInfos(raw, new IfStmt(), parent);
        IfStmt current = root;
        for (int i = 0; i < tests.size(); i++) {
            List<Object> branch = pair(tests.get(i), "If.tests");
            RawNode test = (RawNode) branch.get(0);
            List<RawNode> body = stmtNodes((RawNode) branch.get(1));
            if (i > 0) {
                IfStmt link = setInfos(null, new IfStmt(), current);
                setElifLines(link, test, body);
                current.getOrelse().add(link);
                current = link;
            }
            current.setTest(expr(test, current));
            current.getBody().addAll(statements(body, current));
        }
        current.getOrelse().addAll(statements(stmtNodes(raw.getNode("else_")), current));
        return root;
    }

    private static void setElifLines(IfStmt link, RawNode test, List<RawNode> body) {
        Integer from = test.getFromLineno() != null ? test.getFromLineno() : test.getLineno();
        if (test.getLineno() != null) {
            link.setLineno(test.getLineno());
        }
        if (from != null) {
            link.setFromLineno(from);
        }
        if (!body.isEmpty()) {
            RawNode last = body.get(body.size() - 1);
            Integer to = last.getToLineno() != null ? last.getToLineno() : last.getLineno();
            if (to != null) {
                link.setToLineno(to);
            }
        }
    }

    private AstNode visitFor(RawNode raw, AstNode parent) {
        ForStmt node = setInfos(raw, new ForStmt(), parent);
        node.setTarget(visitIn(AssignContext.ASSIGN, raw.getNode("assign"), node));
        node.setIter(expr(raw.getNode("list"), node));
        node.getBody().addAll(statements(stmtNodes(raw.getNode("body")), node));
        node.getOrelse().addAll(statements(stmtNodes(raw.getNode("else_")), node));
        return node;
    }

    private AstNode visitWhile(RawNode raw, AstNode parent) {
        WhileStmt node = setInfos(raw, new WhileStmt(), parent);
        node.setTest(expr(raw.getNode("test"), node));
        node.getBody().addAll(statements(stmtNodes(raw.getNode("body")), node));
        node.getOrelse().addAll(statements(stmtNodes(raw.getNode("else_")), node));
        return node;
    }

    /** handlers 的每一项是 {@code [类型, 名称, Stmt]} */
    private AstNode visitTryExcept(RawNode raw, AstNode parent) {
        TryExceptStmt node = setInfos(raw, new TryExceptStmt(), parent);
        node.getBody().addAll(statements(stmtNodes(raw.getNode("body")), node));
        for (Object item : raw.getList("handlers")) {
            List<Object> handler = triple(item);
            RawNode type = (RawNode) handler.get(0);
            ExceptHandler except = setInfos(type != null ? type : raw, new ExceptHandler(), node);
            except.setType(expr(type, except));
            except.setName(visitIn(AssignContext.ASSIGN, (RawNode) handler.get(1), except));
            except.getBody().addAll(statements(stmtNodes((RawNode) handler.get(2)), except));
            node.getHandlers().add(except);
        }
        node.getOrelse().addAll(statements(stmtNodes(raw.getNode("else_")), node));
        return node;
    }

    private AstNode visitTryFinally(RawNode raw, AstNode parent) {
        TryFinallyStmt node = setInfos(raw, new TryFinallyStmt(), parent);
        node.getBody().addAll(statements(stmtNodes(raw.getNode("body")), node));
        node.getFinalbody().addAll(statements(stmtNodes(raw.getNode("final")), node));
        return node;
    }

    private AstNode visitWith(RawNode raw, AstNode parent) {
        WithStmt node = setInfos(raw, new WithStmt(), parent);
        node.setExpr(expr(raw.getNode("expr"), node));
        node.setVars(visitIn(AssignContext.ASSIGN, raw.getNode("vars"), node));
        Object body = raw.get("body");
        List<RawNode> statements = body instanceof RawNode ? stmtNodes((RawNode) body) : raw.getNodes("body");
        node.getBody().addAll(statements(statements, node));
        return node;
    }

    private AstNode visitExec(RawNode raw, AstNode parent) {
        ExecStmt node = setInfos(raw, new ExecStmt(), parent);
        node.setExpr(expr(raw.getNode("expr"), node));
        node.setGlobals(expr(raw.getNode("globals"), node));
        node.setLocals(expr(raw.getNode("locals"), node));
        return node;
    }

    private AstNode visitPrint(RawNode raw, AstNode parent, boolean newline) {
        PrintStmt node = setInfos(raw, new PrintStmt(), parent);
        node.setDest(expr(raw.getNode("dest"), node));
        node.getValues().addAll(exprs(raw.getNodes("nodes"), node));
        node.setNewline(newline);
        return node;
    }

    private AstNode visitClass(RawNode raw, AstNode parent) {
        ClassDecl node = setInfos(raw, new ClassDecl(raw.getString("name")), parent);
        enterClass();
        node.getBases().addAll(exprs(raw.getNodes("bases"), node));
        node.setDoc(raw.getString("doc"));
        node.getBody().addAll(statements(stmtNodes(raw.getNode("code")), node));
        finishClass(node);
        return node;
    }

    /** 有装饰器时函数从最后一个装饰器的下一行开始 */
    private AstNode visitFunction(RawNode raw, AstNode parent) {
        FunctionDecl node = setInfos(raw, new FunctionDecl(raw.getString("name")), parent);
        enterFunction();
        RawNode decorators = raw.getNode("decorators");
        if (decorators != null) {
            Decorators decoratorsNode = setInfos(decorators, new Decorators(), node);
            decoratorsNode.getNodes().addAll(exprs(decorators.getNodes("nodes"), decoratorsNode));
            node.setDecorators(decoratorsNode);
            Integer last = lastLine(decorators.getNodes("nodes"));
            if (last != null) {
                node.setFromLineno(last + 1);
            }
        }
        node.setArgs(arguments(raw, node));
        node.setDoc(raw.getString("doc"));
        node.getBody().addAll(statements(stmtNodes(raw.getNode("code")), node));
        finishFunction(node);
        return node;
    }

    private static Integer lastLine(List<RawNode> nodes) {
        Integer last = null;
        for (RawNode node : nodes) {
            Integer line = node.getToLineno() != null ? node.getToLineno() : node.getLineno();
            if (line != null && (last == null || line > last)) {
                last = line;
            }
        }
        return last;
    }

    /**
     * argnames 是名称或嵌套的名称列表；标志位指出末尾的 *args/**kwargs。
     */
    private Arguments arguments(RawNode raw, FunctionBase function) {
        List<Object> argnames = new ArrayList<Object>(raw.getList("argnames"));
        long flags = raw.getLong("flags", 0);
        // 参数只占函数头的行，不取函数的跨度
        Arguments node = setInfos(null, new Arguments(), function);
        if (raw.getLineno() != null) {
            node.setLineno(raw.getLineno());
        }
        if ((flags & CO_VARKEYWORDS) != 0 && !argnames.isEmpty()) {
            node.setKwarg((String) argnames.remove(argnames.size() - 1));
        }
        if ((flags & CO_VARARGS) != 0 && !argnames.isEmpty()) {
            node.setVararg((String) argnames.remove(argnames.size() - 1));
        }
        node.setArgs(nodifyArgs(raw, argnames, node));
        saveArgumentNames(node);
        node.getDefaults().addAll(exprs(raw.getNodes("defaults"), node));
        return node;
    }

    private List<AstNode> nodifyArgs(RawNode raw, List<?> names, AstNode parent) {
        List<AstNode> result = new ArrayList<AstNode>();
        for (Object name : names) {
            if (name instanceof List) {
                TupleExpr tuple = setInfos(raw, new TupleExpr(), parent);
                tuple.getElts().addAll(nodifyArgs(raw, (List<?>) name, tuple));
                result.add(tuple);
            } else if (name instanceof String) {
                AssignName arg = setInfos(raw, new AssignName((String) name), parent);
                saveAssignment(arg, (String) name);
                result.add(arg);
            } else {
                throw new MalformedTreeException("无法识别的参数名: " + name);
            }
        }
        return result;
    }

    private AstNode visitAssSequence(RawNode raw, AstNode parent, CollectionExpr sequence) {
        if (context() == AssignContext.NONE) {
            return deleteStatement(raw, raw.getNodes("nodes"), parent);
        }
        return visitSequence(raw, parent, sequence);
    }

    // ============ 表达式 ============

    /** 增量赋值的目标名称是绑定，其余位置是读取 */
    private AstNode visitName(RawNode raw, AstNode parent) {
        String name = raw.getString("name");
        if (context() == AssignContext.AUG_ASSIGN) {
            return nameNode(raw, name, parent);
        }
        return readName(raw, name, parent);
    }

    private AstNode visitGetattr(RawNode raw, AstNode parent) {
        if (context() == AssignContext.AUG_ASSIGN) {
            return attributeNode(raw, raw.getNode("expr"), raw.getString("attrname"), parent);
        }
        return readAttribute(raw, raw.getNode("expr"), raw.getString("attrname"), parent);
    }

    /** 关键字参数混在 args 中，拆到 keywords */
    private AstNode visitCallFunc(RawNode raw, AstNode parent) {
        CallExpr node = setInfos(raw, new CallExpr(), parent);
        node.setFunc(expr(raw.getNode("node"), node));
        for (RawNode arg : raw.getNodes("args")) {
            AstNode visited = expr(arg, node);
            if (visited instanceof Keyword) {
                node.getKeywords().add((Keyword) visited);
            } else if (visited != null) {
                node.getArgs().add(visited);
            }
        }
        node.setStarargs(expr(raw.getNode("star_args"), node));
        node.setKwargs(expr(raw.getNode("dstar_args"), node));
        return node;
    }

    private AstNode visitKeyword(RawNode raw, AstNode parent) {
        Keyword node = setInfos(raw, new Keyword(raw.getString("name")), parent);
        node.setValue(expr(raw.getNode("expr"), node));
        return node;
    }

    private AstNode visitCompare(RawNode raw, AstNode parent) {
        CompareExpr node = setInfos(raw, new CompareExpr(), parent);
        node.setLeft(expr(raw.getNode("expr"), node));
        for (Object item : raw.getList("ops")) {
            List<Object> op = pair(item, "Compare.ops");
            node.addComparison(CompareOp.fromSymbol((String) op.get(0)), expr((RawNode) op.get(1), node));
        }
        return node;
    }

    /**
     * 多元位运算折叠为左倾二叉树：右操作数是最后一个，
     * 其余操作数合成一个同类节点后按原始输入访问。
     */
    private AstNode visitBitwise(RawNode raw, AstNode parent) {
        List<RawNode> operands = raw.getNodes("nodes");
        if (operands.size() < 2) {
            throw new MalformedTreeException(raw.getType() + " 至少需要两个操作数");
        }
        BinaryExpr node = setInfos(raw, new BinaryExpr(BITWISE_OPS.get(raw.getType())), parent);
        if (operands.size() > 2) {
            RawNode rest = raw.copyLinesTo(RawNode.of(raw.getType())
                    .with("nodes", new ArrayList<Object>(operands.subList(0, operands.size() - 1))));
            node.setLeft(expr(rest, node));
        } else {
            node.setLeft(expr(operands.get(0), node));
        }
        node.setRight(expr(operands.get(operands.size() - 1), node));
        return node;
    }

    private AstNode visitBoolOp(RawNode raw, AstNode parent, BoolOp operator) {
        BoolExpr node = setInfos(raw, new BoolExpr(operator), parent);
        node.getValues().addAll(exprs(raw.getNodes("nodes"), node));
        return node;
    }

    /**
     * 下标：单个 Sliceobj 是切片，含 Sliceobj 的多个下标是扩展切片，否则是索引
     * （多个索引组成元组）。语句位置上表示 del。
     */
    private AstNode visitSubscript(RawNode raw, AstNode parent) {
        if (context() == AssignContext.NONE) {
            return deleteStatement(raw, Collections.singletonList(raw), parent);
        }
        SubscriptExpr node = setInfos(raw, new SubscriptExpr(), parent);
        node.setValue(expr(raw.getNode("expr"), node));
        List<RawNode> subs = raw.getNodes("subs");
        boolean hasSlice = false;
        for (RawNode sub : subs) {
            hasSlice |= sub != null && "Sliceobj".equals(sub.getType());
        }
        if (hasSlice && subs.size() == 1) {
            node.setSlice(expr(subs.get(0), node));
        } else if (hasSlice) {
            ExtSliceExpr ext = setInfos(raw, new ExtSliceExpr(), node);
            for (RawNode sub : subs) {
                if ("Sliceobj".equals(sub.getType())) {
                    ext.getDims().add(expr(sub, ext));
                } else {
                    IndexSlice index = setInfos(sub, new IndexSlice(), ext);
                    index.setValue(expr(sub, index));
                    ext.getDims().add(index);
                }
            }
            node.setSlice(ext);
        } else {
            IndexSlice index = setInfos(raw, new IndexSlice(), node);
            if (subs.size() == 1) {
                index.setValue(expr(subs.get(0), index));
            } else {
                TupleExpr tuple = setInfos(raw, new TupleExpr(), index);
                tuple.getElts().addAll(exprs(subs, tuple));
                index.setValue(tuple);
            }
            node.setSlice(index);
        }
        return node;
    }

    /** {@code a[x:y]} 形式：两个边界，没有步长 */
    private AstNode visitSlice(RawNode raw, AstNode parent) {
        if (context() == AssignContext.NONE) {
            return deleteStatement(raw, Collections.singletonList(raw), parent);
        }
        SubscriptExpr node = setInfos(raw, new SubscriptExpr(), parent);
        node.setValue(expr(raw.getNode("expr"), node));
        node.setSlice(slice(raw, raw.getNode("lower"), raw.getNode("upper"), null, node));
        return node;
    }

    /** 两个元素的 Sliceobj 没有步长 */
    private AstNode visitSliceobj(RawNode raw, AstNode parent) {
        List<RawNode> bounds = raw.getNodes("nodes");
        RawNode lower = bounds.size() > 0 ? bounds.get(0) : null;
        RawNode upper = bounds.size() > 1 ? bounds.get(1) : null;
        RawNode step = bounds.size() > 2 ? bounds.get(2) : null;
        return slice(raw, lower, upper, step, parent);
    }

    private SliceExpr slice(RawNode raw, RawNode lower, RawNode upper, RawNode step, AstNode parent) {
        SliceExpr node = setInfos(raw, new SliceExpr(), parent);
        node.setLower(expr(filterNone(lower), node));
        node.setUpper(expr(filterNone(upper), node));
        node.setStep(expr(filterNone(step), node));
        return node;
    }

    /** 元素沿用当前上下文（赋值目标中的元组把绑定传递给元素） */
    private AstNode visitSequence(RawNode raw, AstNode parent, CollectionExpr sequence) {
        CollectionExpr node = setInfos(raw, sequence, parent);
        AssignContext elements = context() == AssignContext.NONE ? AssignContext.DISCARD : context();
        for (RawNode element : raw.getNodes("nodes")) {
            AstNode visited = visitIn(elements, element, node);
            if (visited != null) {
                node.getElts().add(visited);
            }
        }
        return node;
    }

    /** items 的每一项是 {@code [键, 值]} */
    private AstNode visitDict(RawNode raw, AstNode parent) {
        DictExpr node = setInfos(raw, new DictExpr(), parent);
        for (Object item : raw.getList("items")) {
            List<Object> entry = pair(item, "Dict.items");
            AstNode key = expr((RawNode) entry.get(0), node);
            AstNode value = expr((RawNode) entry.get(1), node);
            node.addItem(key, value);
        }
        return node;
    }

    private AstNode visitListComp(RawNode raw, AstNode parent) {
        ListCompExpr node = setInfos(raw, new ListCompExpr(), parent);
        node.setElt(expr(raw.getNode("expr"), node));
        node.getGenerators().addAll(qualifiers(raw.getNodes("quals"), node));
        return node;
    }

    /** GenExprInner 被去掉：元素和子句直接挂在生成器表达式上 */
    private AstNode visitGenExpr(RawNode raw, AstNode parent) {
        GeneratorExpr node = setInfos(raw, new GeneratorExpr(), parent);
        RawNode inner = raw.getNode("code");
        if (inner == null) {
            throw new MalformedTreeException("GenExpr 缺少 code");
        }
        node.setElt(expr(inner.getNode("expr"), node));
        node.getGenerators().addAll(qualifiers(inner.getNodes("quals"), node));
        return node;
    }

    private AstNode visitSetComp(RawNode raw, AstNode parent) {
        SetCompExpr node = setInfos(raw, new SetCompExpr(), parent);
        node.setElt(expr(raw.getNode("expr"), node));
        node.getGenerators().addAll(qualifiers(raw.getNodes("quals"), node));
        return node;
    }

    private AstNode visitDictComp(RawNode raw, AstNode parent) {
        DictCompExpr node = setInfos(raw, new DictCompExpr(), parent);
        node.setKey(expr(raw.getNode("key"), node));
        node.setValue(expr(raw.getNode("value"), node));
        node.getGenerators().addAll(qualifiers(raw.getNodes("quals"), node));
        return node;
    }

    /** ListCompFor 的可迭代对象在 list 字段，GenExprFor 的在 iter 字段；过滤条件包在 *If 节点中 */
    private List<Comprehension> qualifiers(List<RawNode> quals, AstNode parent) {
        List<Comprehension> result = new ArrayList<Comprehension>();
        for (RawNode qual : quals) {
            RawNode iter = qual.has("list") ? qual.getNode("list") : qual.getNode("iter");
            List<RawNode> ifs = new ArrayList<RawNode>();
            for (RawNode condition : qual.getNodes("ifs")) {
                ifs.add(condition.getNode("test"));
            }
            result.add(comprehension(qual, qual.getNode("assign"), iter, ifs, parent));
        }
        return result;
    }

    /** 语句位置上的 yield 包装为表达式语句 */
    private AstNode visitYield(RawNode raw, AstNode parent) {
        if (context() == AssignContext.NONE) {
            ExprStmt statement = setInfos(raw, new ExprStmt(), parent);
            statement.setValue(expr(raw, statement));
            return statement;
        }
        YieldExpr node = setInfos(raw, new YieldExpr(), parent);
        node.setValue(expr(raw.getNode("value"), node));
        return node;
    }

    private AstNode visitIfExp(RawNode raw, AstNode parent) {
        IfExpr node = setInfos(raw, new IfExpr(), parent);
        node.setTest(expr(raw.getNode("test"), node));
        node.setBody(expr(raw.getNode("then"), node));
        node.setOrelse(expr(raw.getNode("else_"), node));
        return node;
    }

    private AstNode visitLambda(RawNode raw, AstNode parent) {
        LambdaExpr node = setInfos(raw, new LambdaExpr(), parent);
        node.setArgs(arguments(raw, node));
        node.setBody(expr(raw.getNode("code"), node));
        return node;
    }

    // ============ 辅助 ============

    /** Stmt 节点中的语句；null 表示空 */
    private static List<RawNode> stmtNodes(RawNode stmt) {
        if (stmt == null) {
            return Collections.emptyList();
        }
        return stmt.getNodes("nodes");
    }

    /** 显式的 None 常量表示缺省 */
    private static RawNode filterNone(RawNode raw) {
        if (raw != null && "Const".equals(raw.getType()) && raw.get("value") == null) {
            return null;
        }
        return raw;
    }

    private static List<ImportAlias> aliases(RawNode raw) {
        List<ImportAlias> result = new ArrayList<ImportAlias>();
        for (Object item : raw.getList("names")) {
            List<Object> alias = pair(item, raw.getType() + ".names");
            result.add(new ImportAlias((String) alias.get(0), (String) alias.get(1)));
        }
        return result;
    }

    private static List<String> strings(List<Object> values) {
        List<String> result = new ArrayList<String>();
        for (Object value : values) {
            result.add((String) value);
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> pair(Object item, String where) {
        if (!(item instanceof List) || ((List<Object>) item).size() != 2) {
            throw new MalformedTreeException(where + " 的元素必须是二元组: " + item);
        }
        return (List<Object>) item;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> triple(Object item) {
        if (!(item instanceof List) || ((List<Object>) item).size() != 3) {
            throw new MalformedTreeException("TryExcept.handlers 的元素必须是三元组: " + item);
        }
        return (List<Object>) item;
    }
}
