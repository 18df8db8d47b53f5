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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code _ast} 形状的解析树重建器
 *
 * <p>语句与表达式节点一一对应，绑定位置由所在结构决定（赋值目标、循环变量、参数等），
 * 节点自带的 ctx 字段不参与判断。模块、类和函数语句体开头的字符串表达式语句作为文档字符串移出。</p>
 */
public class AstTreeRebuilder extends TreeRebuilder {

    private static final Map<String, BinaryOp> BINARY_OPS = new HashMap<String, BinaryOp>();
    private static final Map<String, UnaryOp> UNARY_OPS = new HashMap<String, UnaryOp>();
    private static final Map<String, BoolOp> BOOL_OPS = new HashMap<String, BoolOp>();
    private static final Map<String, CompareOp> COMPARE_OPS = new HashMap<String, CompareOp>();

    static {
        BINARY_OPS.put("Add", BinaryOp.ADD);
        BINARY_OPS.put("Sub", BinaryOp.SUB);
        BINARY_OPS.put("Mult", BinaryOp.MUL);
        BINARY_OPS.put("Div", BinaryOp.DIV);
        BINARY_OPS.put("FloorDiv", BinaryOp.FLOOR_DIV);
        BINARY_OPS.put("Mod", BinaryOp.MOD);
        BINARY_OPS.put("Pow", BinaryOp.POW);
        BINARY_OPS.put("LShift", BinaryOp.LSHIFT);
        BINARY_OPS.put("RShift", BinaryOp.RSHIFT);
        BINARY_OPS.put("BitAnd", BinaryOp.BIT_AND);
        BINARY_OPS.put("BitOr", BinaryOp.BIT_OR);
        BINARY_OPS.put("BitXor", BinaryOp.BIT_XOR);
        BOOL_OPS.put("And", BoolOp.AND);
        BOOL_OPS.put("Or", BoolOp.OR);
        UNARY_OPS.put("UAdd", UnaryOp.POS);
        UNARY_OPS.put("USub", UnaryOp.NEG);
        UNARY_OPS.put("Not", UnaryOp.NOT);
        UNARY_OPS.put("Invert", UnaryOp.INVERT);
        COMPARE_OPS.put("Eq", CompareOp.EQ);
        COMPARE_OPS.put("NotEq", CompareOp.NE);
        COMPARE_OPS.put("Lt", CompareOp.LT);
        COMPARE_OPS.put("LtE", CompareOp.LE);
        COMPARE_OPS.put("Gt", CompareOp.GT);
        COMPARE_OPS.put("GtE", CompareOp.GE);
        COMPARE_OPS.put("Is", CompareOp.IS);
        COMPARE_OPS.put("IsNot", CompareOp.IS_NOT);
        COMPARE_OPS.put("In", CompareOp.IN);
        COMPARE_OPS.put("NotIn", CompareOp.NOT_IN);
    }

    public AstTreeRebuilder(ModuleResolver resolver, BuilderConfig config) {
        super(resolver, config);
    }

    @Override
    protected void rebuildModule(RawNode raw, ModuleDecl module) {
        List<RawNode> body = raw.getNodes("body");
        module.setDoc(docstring(body));
        module.getBody().addAll(statements(withoutDocstring(body), module));
    }

    @Override
    protected AstNode visit(RawNode raw, AstNode parent) {
        if (raw == null) {
            return null;
        }
        switch (raw.getType()) {
            // 语句
            case "ClassDef": return visitClassDef(raw, parent);
            case "FunctionDef": return visitFunctionDef(raw, parent);
            case "Assign": return visitAssign(raw, parent);
            case "AugAssign": return visitAugAssign(raw, parent);
            case "Delete": return deleteStatement(raw, raw.getNodes("targets"), parent);
            case "Expr": {
                ExprStmt node = setInfos(raw, new ExprStmt(), parent);
                node.setValue(expr(raw.getNode("value"), node));
                return node;
            }
            case "Pass": return setInfos(raw, new PassStmt(), parent);
            case "Break": return setInfos(raw, new BreakStmt(), parent);
            case "Continue": return setInfos(raw, new ContinueStmt(), parent);
            case "Return": {
                ReturnStmt node = setInfos(raw, new ReturnStmt(), parent);
                node.setValue(expr(raw.getNode("value"), node));
                return node;
            }
            case "Raise": return visitRaise(raw, parent);
            case "Assert": {
                AssertStmt node = setInfos(raw, new AssertStmt(), parent);
                node.setTest(expr(raw.getNode("test"), node));
                node.setFail(expr(raw.getNode("msg"), node));
                return node;
            }
            case "If": return visitIf(raw, parent);
            case "For": return visitFor(raw, parent);
            case "While": return visitWhile(raw, parent);
            case "TryExcept": return visitTryExcept(raw, parent);
            case "ExceptHandler": return visitExceptHandler(raw, parent);
            case "TryFinally": return visitTryFinally(raw, parent);
            case "Try": return visitTry(raw, parent);
            case "With": return visitWith(raw, parent);
            case "Import": return importStatement(raw, aliases(raw), parent);
            case "ImportFrom":
                return fromImportStatement(raw, raw.getString("module"), (int) raw.getLong("level", 0),
                        aliases(raw), parent);
            case "Global": return globalStatement(raw, strings(raw.getList("names")), parent);
            case "Exec": {
                ExecStmt node = setInfos(raw, new ExecStmt(), parent);
                node.setExpr(expr(raw.getNode("body"), node));
                node.setGlobals(expr(raw.getNode("globals"), node));
                node.setLocals(expr(raw.getNode("locals"), node));
                return node;
            }
            case "Print": {
                PrintStmt node = setInfos(raw, new PrintStmt(), parent);
                node.setDest(expr(raw.getNode("dest"), node));
                node.getValues().addAll(exprs(raw.getNodes("values"), node));
                node.setNewline(raw.getBoolean("nl"));
                return node;
            }

            // 表达式
            case "Name": return visitName(raw, parent);
            case "Attribute": return visitAttribute(raw, parent);
            case "Subscript": return visitSubscript(raw, parent);
            case "Num": return setInfos(raw, new Const(raw.get("n")), parent);
            case "Str": return setInfos(raw, new Const(raw.get("s")), parent);
            case "Constant":
            case "NameConstant":
                return setInfos(raw, new Const(raw.get("value")), parent);
            case "Ellipsis": return setInfos(raw, new EllipsisExpr(), parent);
            case "BinOp": return visitBinOp(raw, parent);
            case "BoolOp": return visitBoolOp(raw, parent);
            case "UnaryOp": return visitUnaryOp(raw, parent);
            case "Compare": return visitCompare(raw, parent);
            case "Call": return visitCall(raw, parent);
            case "keyword": {
                Keyword node = setInfos(raw, new Keyword(raw.getString("arg")), parent);
                node.setValue(expr(raw.getNode("value"), node));
                return node;
            }
            case "IfExp": {
                IfExpr node = setInfos(raw, new IfExpr(), parent);
                node.setTest(expr(raw.getNode("test"), node));
                node.setBody(expr(raw.getNode("body"), node));
                node.setOrelse(expr(raw.getNode("orelse"), node));
                return node;
            }
            case "Lambda": {
                LambdaExpr node = setInfos(raw, new LambdaExpr(), parent);
                node.setArgs(arguments(raw.getNode("args"), node));
                node.setBody(expr(raw.getNode("body"), node));
                return node;
            }
            case "Tuple": return visitSequence(raw, parent, new TupleExpr());
            case "List": return visitSequence(raw, parent, new ListExpr());
            case "Set": return visitSequence(raw, parent, new SetExpr());
            case "Dict": return visitDict(raw, parent);
            case "ListComp": {
                ListCompExpr node = setInfos(raw, new ListCompExpr(), parent);
                node.setElt(expr(raw.getNode("elt"), node));
                node.getGenerators().addAll(generators(raw, node));
                return node;
            }
            case "GeneratorExp": {
                GeneratorExpr node = setInfos(raw, new GeneratorExpr(), parent);
                node.setElt(expr(raw.getNode("elt"), node));
                node.getGenerators().addAll(generators(raw, node));
                return node;
            }
            case "SetComp": {
                SetCompExpr node = setInfos(raw, new SetCompExpr(), parent);
                node.setElt(expr(raw.getNode("elt"), node));
                node.getGenerators().addAll(generators(raw, node));
                return node;
            }
            case "DictComp": {
                DictCompExpr node = setInfos(raw, new DictCompExpr(), parent);
                node.setKey(expr(raw.getNode("key"), node));
                node.setValue(expr(raw.getNode("value"), node));
                node.getGenerators().addAll(generators(raw, node));
                return node;
            }
            case "Yield": {
                YieldExpr node = setInfos(raw, new YieldExpr(), parent);
                node.setValue(expr(raw.getNode("value"), node));
                return node;
            }
            case "Repr": {
                BackquoteExpr node = setInfos(raw, new BackquoteExpr(), parent);
                node.setValue(expr(raw.getNode("value"), node));
                return node;
            }
            default: return unknownNode(raw, parent);
        }
    }

    // ============ 语句 ============

    private AstNode visitClassDef(RawNode raw, AstNode parent) {
        ClassDecl node = setInfos(raw, new ClassDecl(raw.getString("name")), parent);
        enterClass();
        node.getBases().addAll(exprs(raw.getNodes("bases"), node));
        List<RawNode> body = raw.getNodes("body");
        node.setDoc(docstring(body));
        node.getBody().addAll(statements(withoutDocstring(body), node));
        finishClass(node);
        return node;
    }

    /** 装饰器函数的行号是第一个装饰器所在行，def 语句在其后 */
    private AstNode visitFunctionDef(RawNode raw, AstNode parent) {
        FunctionDecl node = setInfos(raw, new FunctionDecl(raw.getString("name")), parent);
        enterFunction();
        List<RawNode> decorators = raw.getNodes("decorator_list");
        if (!decorators.isEmpty()) {
            Decorators decoratorsNode = setInfos(raw, new Decorators(), node);
            decoratorsNode.getNodes().addAll(exprs(decorators, decoratorsNode));
            node.setDecorators(decoratorsNode);
            if (raw.getFromLineno() == null && raw.getLineno() != null) {
                node.setFromLineno(raw.getLineno() + decorators.size());
            }
        }
        node.setArgs(arguments(raw.getNode("args"), node));
        List<RawNode> body = raw.getNodes("body");
        node.setDoc(docstring(body));
        node.getBody().addAll(statements(withoutDocstring(body), node));
        finishFunction(node);
        return node;
    }

    /** 参数在赋值上下文中访问，元组参数随之解构 */
    private Arguments arguments(RawNode raw, FunctionBase function) {
        Arguments node = setInfos(raw, new Arguments(), function);
        if (raw == null) {
            return node;
        }
        node.setVararg(raw.getString("vararg"));
        node.setKwarg(raw.getString("kwarg"));
        List<AstNode> args = new ArrayList<AstNode>();
        for (RawNode arg : raw.getNodes("args")) {
            AstNode visited = visitIn(AssignContext.ASSIGN, arg, node);
            if (visited != null) {
                args.add(visited);
            }
        }
        node.setArgs(args);
        saveArgumentNames(node);
        node.getDefaults().addAll(exprs(raw.getNodes("defaults"), node));
        return node;
    }

    private AstNode visitAssign(RawNode raw, AstNode parent) {
        AssignStmt node = setInfos(raw, new AssignStmt(), parent);
        for (RawNode target : raw.getNodes("targets")) {
            node.getTargets().add(visitIn(AssignContext.ASSIGN, target, node));
        }
        node.setValue(expr(raw.getNode("value"), node));
        setAssignInfos(node);
        return node;
    }

    private AstNode visitAugAssign(RawNode raw, AstNode parent) {
        AugAssignStmt node = setInfos(raw, new AugAssignStmt(), parent);
        node.setTarget(visitIn(AssignContext.AUG_ASSIGN, raw.getNode("target"), node));
        node.setOperator(operator(BINARY_OPS, raw.getNode("op")));
        node.setValue(expr(raw.getNode("value"), node));
        return node;
    }

    /** 同时接受 type/inst/tback 与 exc 两种字段写法 */
    private AstNode visitRaise(RawNode raw, AstNode parent) {
        RaiseStmt node = setInfos(raw, new RaiseStmt(), parent);
        node.setExceptionType(expr(raw.has("exc") ? raw.getNode("exc") : raw.getNode("type"), node));
        node.setExceptionValue(expr(raw.getNode("inst"), node));
        node.setTraceback(expr(raw.getNode("tback"), node));
        return node;
    }

    private AstNode visitIf(RawNode raw, AstNode parent) {
        IfStmt node = setInfos(raw, new IfStmt(), parent);
        node.setTest(expr(raw.getNode("test"), node));
        node.getBody().addAll(statements(raw.getNodes("body"), node));
        node.getOrelse().addAll(statements(raw.getNodes("orelse"), node));
        return node;
    }

    private AstNode visitFor(RawNode raw, AstNode parent) {
        ForStmt node = setInfos(raw, new ForStmt(), parent);
        node.setTarget(visitIn(AssignContext.ASSIGN, raw.getNode("target"), node));
        node.setIter(expr(raw.getNode("iter"), node));
        node.getBody().addAll(statements(raw.getNodes("body"), node));
        node.getOrelse().addAll(statements(raw.getNodes("orelse"), node));
        return node;
    }

    private AstNode visitWhile(RawNode raw, AstNode parent) {
        WhileStmt node = setInfos(raw, new WhileStmt(), parent);
        node.setTest(expr(raw.getNode("test"), node));
        node.getBody().addAll(statements(raw.getNodes("body"), node));
        node.getOrelse().addAll(statements(raw.getNodes("orelse"), node));
        return node;
    }

    private AstNode visitTryExcept(RawNode raw, AstNode parent) {
        TryExceptStmt node = setInfos(raw, new TryExceptStmt(), parent);
        fillTryExcept(raw, node);
        return node;
    }

    private void fillTryExcept(RawNode raw, TryExceptStmt node) {
        node.getBody().addAll(statements(raw.getNodes("body"), node));
        for (RawNode handler : raw.getNodes("handlers")) {
            node.getHandlers().add((ExceptHandler) visitIn(AssignContext.NONE, handler, node));
        }
        node.getOrelse().addAll(statements(raw.getNodes("orelse"), node));
    }

    private AstNode visitExceptHandler(RawNode raw, AstNode parent) {
        ExceptHandler node = setInfos(raw, new ExceptHandler(), parent);
        node.setType(expr(raw.getNode("type"), node));
        Object name = raw.get("name");
        if (name instanceof String) {
            RawNode target = raw.copyLinesTo(RawNode.of("Name").with("id", name));
            node.setName(visitIn(AssignContext.ASSIGN, target, node));
        } else {
            node.setName(visitIn(AssignContext.ASSIGN, raw.getNode("name"), node));
        }
        node.getBody().addAll(statements(raw.getNodes("body"), node));
        return node;
    }

    private AstNode visitTryFinally(RawNode raw, AstNode parent) {
        TryFinallyStmt node = setInfos(raw, new TryFinallyStmt(), parent);
        node.getBody().addAll(statements(raw.getNodes("body"), node));
        node.getFinalbody().addAll(statements(raw.getNodes("finalbody"), node));
        return node;
    }

    /** 合并写法的 try：同时有 except 与 finally 时拆成 try-finally 包裹 try-except */
    private AstNode visitTry(RawNode raw, AstNode parent) {
        List<RawNode> handlers = raw.getNodes("handlers");
        List<RawNode> finalbody = raw.getNodes("finalbody");
        if (finalbody.isEmpty()) {
            return visitTryExcept(raw, parent);
        }
        if (handlers.isEmpty()) {
            return visitTryFinally(raw, parent);
        }
        TryFinallyStmt node = setInfos(raw, new TryFinallyStmt(), parent);
        TryExceptStmt inner = setInfos(raw, new TryExceptStmt(), node);
        fillTryExcept(raw, inner);
        node.getBody().add(inner);
        node.getFinalbody().addAll(statements(finalbody, node));
        return node;
    }

    /** 只有一个上下文管理器；items 写法取第一项 */
    private AstNode visitWith(RawNode raw, AstNode parent) {
        WithStmt node = setInfos(raw, new WithStmt(), parent);
        RawNode item = raw;
        List<RawNode> items = raw.getNodes("items");
        if (!items.isEmpty()) {
            if (items.size() > 1) {
                throw new MalformedTreeException("With 只支持一个上下文管理器");
            }
            item = items.get(0);
        }
        node.setExpr(expr(item.getNode("context_expr"), node));
        node.setVars(visitIn(AssignContext.ASSIGN, item.getNode("optional_vars"), node));
        node.getBody().addAll(statements(raw.getNodes("body"), node));
        return node;
    }

    // ============ 表达式 ============

    private AstNode visitName(RawNode raw, AstNode parent) {
        String name = raw.getString("id");
        switch (context()) {
            case ASSIGN:
            case AUG_ASSIGN:
            case DELETE:
                return nameNode(raw, name, parent);
            default:
                return readName(raw, name, parent);
        }
    }

    private AstNode visitAttribute(RawNode raw, AstNode parent) {
        String attrname = raw.getString("attr");
        switch (context()) {
            case ASSIGN:
            case AUG_ASSIGN:
            case DELETE:
                return attributeNode(raw, raw.getNode("value"), attrname, parent);
            default:
                return readAttribute(raw, raw.getNode("value"), attrname, parent);
        }
    }

    private AstNode visitSubscript(RawNode raw, AstNode parent) {
        SubscriptExpr node = setInfos(raw, new SubscriptExpr(), parent);
        node.setValue(expr(raw.getNode("value"), node));
        node.setSlice(slice(raw.getNode("slice"), node));
        return node;
    }

    /**
     * Index/Slice/ExtSlice 直接对应；裸表达式是索引，含切片的元组是扩展切片。
     */
    private AstNode slice(RawNode raw, AstNode parent) {
        if (raw == null) {
            throw new MalformedTreeException("Subscript 缺少 slice");
        }
        switch (raw.getType()) {
            case "Index": {
                IndexSlice node = setInfos(raw, new IndexSlice(), parent);
                node.setValue(expr(raw.getNode("value"), node));
                return node;
            }
            case "Slice": {
                SliceExpr node = setInfos(raw, new SliceExpr(), parent);
                node.setLower(expr(raw.getNode("lower"), node));
                node.setUpper(expr(raw.getNode("upper"), node));
                node.setStep(expr(raw.getNode("step"), node));
                return node;
            }
            case "ExtSlice":
                return extSlice(raw, raw.getNodes("dims"), parent);
            case "Tuple":
                for (RawNode element : raw.getNodes("elts")) {
                    if (RawNode.isType(element, "Slice")) {
                        return extSlice(raw, raw.getNodes("elts"), parent);
                    }
                }
                break;
            default:
                break;
        }
        IndexSlice node = setInfos(raw, new IndexSlice(), parent);
        node.setValue(expr(raw, node));
        return node;
    }

    private AstNode extSlice(RawNode raw, List<RawNode> dims, AstNode parent) {
        ExtSliceExpr node = setInfos(raw, new ExtSliceExpr(), parent);
        for (RawNode dim : dims) {
            node.getDims().add(slice(dim, node));
        }
        return node;
    }

    private AstNode visitBinOp(RawNode raw, AstNode parent) {
        BinaryExpr node = setInfos(raw, new BinaryExpr(operator(BINARY_OPS, raw.getNode("op"))), parent);
        node.setLeft(expr(raw.getNode("left"), node));
        node.setRight(expr(raw.getNode("right"), node));
        return node;
    }

    private AstNode visitBoolOp(RawNode raw, AstNode parent) {
        BoolExpr node = setInfos(raw, new BoolExpr(operator(BOOL_OPS, raw.getNode("op"))), parent);
        node.getValues().addAll(exprs(raw.getNodes("values"), node));
        return node;
    }

    private AstNode visitUnaryOp(RawNode raw, AstNode parent) {
        UnaryExpr node = setInfos(raw, new UnaryExpr(operator(UNARY_OPS, raw.getNode("op"))), parent);
        node.setOperand(expr(raw.getNode("operand"), node));
        return node;
    }

    private AstNode visitCompare(RawNode raw, AstNode parent) {
        CompareExpr node = setInfos(raw, new CompareExpr(), parent);
        node.setLeft(expr(raw.getNode("left"), node));
        List<RawNode> ops = raw.getNodes("ops");
        List<RawNode> comparators = raw.getNodes("comparators");
        if (ops.size() != comparators.size()) {
            throw new MalformedTreeException("Compare 的运算符与操作数个数不一致");
        }
        for (int i = 0; i < ops.size(); i++) {
            node.addComparison(operator(COMPARE_OPS, ops.get(i)), expr(comparators.get(i), node));
        }
        return node;
    }

    private AstNode visitCall(RawNode raw, AstNode parent) {
        CallExpr node = setInfos(raw, new CallExpr(), parent);
        node.setFunc(expr(raw.getNode("func"), node));
        node.getArgs().addAll(exprs(raw.getNodes("args"), node));
        for (RawNode keyword : raw.getNodes("keywords")) {
            node.getKeywords().add((Keyword) expr(keyword, node));
        }
        node.setStarargs(expr(raw.getNode("starargs"), node));
        node.setKwargs(expr(raw.getNode("kwargs"), node));
        return node;
    }

    /** 元素沿用当前的绑定上下文，读取位置上按读取访问 */
    private AstNode visitSequence(RawNode raw, AstNode parent, CollectionExpr sequence) {
        CollectionExpr node = setInfos(raw, sequence, parent);
        AssignContext elements = context() == AssignContext.NONE ? AssignContext.DISCARD : context();
        for (RawNode element : raw.getNodes("elts")) {
            AstNode visited = visitIn(elements, element, node);
            if (visited != null) {
                node.getElts().add(visited);
            }
        }
        return node;
    }

    private AstNode visitDict(RawNode raw, AstNode parent) {
        DictExpr node = setInfos(raw, new DictExpr(), parent);
        List<RawNode> keys = raw.getNodes("keys");
        List<RawNode> values = raw.getNodes("values");
        if (keys.size() != values.size()) {
            throw new MalformedTreeException("Dict 的键与值个数不一致");
        }
        for (int i = 0; i < keys.size(); i++) {
            node.addItem(expr(keys.get(i), node), expr(values.get(i), node));
        }
        return node;
    }

    private List<Comprehension> generators(RawNode raw, AstNode parent) {
        List<Comprehension> result = new ArrayList<Comprehension>();
        for (RawNode generator : raw.getNodes("generators")) {
            result.add(comprehension(generator, generator.getNode("target"), generator.getNode("iter"),
                    generator.getNodes("ifs"), parent));
        }
        return result;
    }

    // ============ 辅助 ============

    /** 语句体开头的字符串表达式语句 */
    private static String docstring(List<RawNode> body) {
        if (body.isEmpty() || !RawNode.isType(body.get(0), "Expr")) {
            return null;
        }
        RawNode value = body.get(0).getNode("value");
        if (RawNode.isType(value, "Str")) {
            return value.getString("s");
        }
        if (RawNode.isType(value, "Constant") && value.get("value") instanceof String) {
            return (String) value.get("value");
        }
        return null;
    }

    private static List<RawNode> withoutDocstring(List<RawNode> body) {
        return docstring(body) != null ? body.subList(1, body.size()) : body;
    }

    private static <T> T operator(Map<String, T> operators, RawNode op) {
        T operator = op != null ? operators.get(op.getType()) : null;
        if (operator == null) {
            throw new MalformedTreeException("无法识别的运算符: " + op);
        }
        return operator;
    }

    private static List<ImportAlias> aliases(RawNode raw) {
        List<ImportAlias> result = new ArrayList<ImportAlias>();
        for (RawNode alias : raw.getNodes("names")) {
            result.add(new ImportAlias(alias.getString("name"), alias.getString("asname")));
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
}
