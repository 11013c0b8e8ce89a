package opsugar;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import opsugar.processor.SyntaxChild;
import opsugar.processor.SyntaxNode;

public final class Ast {

  public enum Kind {
    COMMENT,
    COMMENT_GROUP,
    FIELD,
    FIELD_LIST,
    BAD_EXPR,
    IDENT,
    BASIC_LIT,
    ELLIPSIS,
    FUNC_LIT,
    COMPOSITE_LIT,
    PAREN_EXPR,
    SELECTOR_EXPR,
    INDEX_EXPR,
    SLICE_EXPR,
    TYPE_ASSERT_EXPR,
    CALL_EXPR,
    STAR_EXPR,
    UNARY_EXPR,
    BINARY_EXPR,
    KEY_VALUE_EXPR,
    ARRAY_TYPE,
    STRUCT_TYPE,
    FUNC_TYPE,
    INTERFACE_TYPE,
    MAP_TYPE,
    CHAN_TYPE,
    BAD_STMT,
    DECL_STMT,
    EMPTY_STMT,
    LABELED_STMT,
    EXPR_STMT,
    SEND_STMT,
    INC_DEC_STMT,
    ASSIGN_STMT,
    GO_STMT,
    DEFER_STMT,
    RETURN_STMT,
    BRANCH_STMT,
    BLOCK_STMT,
    IF_STMT,
    CASE_CLAUSE,
    SWITCH_STMT,
    TYPE_SWITCH_STMT,
    COMM_CLAUSE,
    SELECT_STMT,
    FOR_STMT,
    RANGE_STMT,
    IMPORT_SPEC,
    VALUE_SPEC,
    TYPE_SPEC,
    BAD_DECL,
    GEN_DECL,
    FUNC_DECL,
    FILE,
    PACKAGE,
    TREE_ROOT;
  }

  public enum LitKind {
    INT,
    FLOAT,
    IMAG,
    CHAR,
    STRING;
  }

  public enum ChanDir {
    SEND,
    RECV,
    BOTH;
  }

  public abstract static class Node implements SyntaxNodeInterface {
    private final Kind kind;

    protected Node(Kind kind) {
      this.kind = kind;
    }

    public final Kind kind() {
      return kind;
    }

    @SuppressWarnings("unchecked")
    public <T extends Node> T cast() {
      return (T) this;
    }

    @Override
    public String toString() {
      return SourcePrinter.print(this);
    }
  }

  public abstract static class Expr extends Node {
    protected Expr(Kind kind) {
      super(kind);
    }
  }

  public abstract static class Stmt extends Node {
    protected Stmt(Kind kind) {
      super(kind);
    }
  }

  public abstract static class Decl extends Node {
    protected Decl(Kind kind) {
      super(kind);
    }
  }

  public abstract static class Spec extends Node {
    protected Spec(Kind kind) {
      super(kind);
    }
  }

  @SyntaxNode
  public static final class Comment extends Node implements Ast_Comment_SyntaxNode {
    private final String text;

    private Comment(String text) {
      super(Kind.COMMENT);
      this.text = Preconditions.checkNotNull(text);
    }

    public static Comment of(String text) {
      return new Comment(text);
    }

    public String text() {
      return text;
    }
  }

  @SyntaxNode
  public static final class CommentGroup extends Node implements Ast_CommentGroup_SyntaxNode {
    private final List<Comment> list;

    private CommentGroup(List<Comment> list) {
      super(Kind.COMMENT_GROUP);
      this.list = new ArrayList<>(list);
    }

    public static CommentGroup of(List<Comment> list) {
      return new CommentGroup(list);
    }

    @SyntaxChild
    @Override
    public List<Comment> list() {
      return list;
    }
  }

  // Interface methods have a FuncType type.
  @SyntaxNode
  public static final class Field extends Node implements Ast_Field_SyntaxNode {
    private CommentGroup doc;
    private final List<Ident> names;
    private Expr type;
    private BasicLit tag;
    private CommentGroup comment;

    private Field(
        CommentGroup doc,
        List<Ident> names,
        Expr type,
        BasicLit tag,
        CommentGroup comment) {
      super(Kind.FIELD);
      this.doc = doc;
      this.names = new ArrayList<>(names);
      this.type = type;
      this.tag = tag;
      this.comment = comment;
    }

    public static Field of(
        CommentGroup doc,
        List<Ident> names,
        Expr type,
        BasicLit tag,
        CommentGroup comment) {
      return new Field(doc, names, type, tag, comment);
    }

    @SyntaxChild
    @Override
    public CommentGroup doc() {
      return doc;
    }

    @Override
    public void setDoc(CommentGroup doc) {
      this.doc = doc;
    }

    @SyntaxChild
    @Override
    public List<Ident> names() {
      return names;
    }

    @SyntaxChild
    @Override
    public Expr type() {
      return type;
    }

    @Override
    public void setType(Expr type) {
      this.type = type;
    }

    @SyntaxChild
    @Override
    public BasicLit tag() {
      return tag;
    }

    @Override
    public void setTag(BasicLit tag) {
      this.tag = tag;
    }

    @SyntaxChild
    @Override
    public CommentGroup comment() {
      return comment;
    }

    @Override
    public void setComment(CommentGroup comment) {
      this.comment = comment;
    }
  }

  @SyntaxNode
  public static final class FieldList extends Node implements Ast_FieldList_SyntaxNode {
    private final List<Field> list;

    private FieldList(List<Field> list) {
      super(Kind.FIELD_LIST);
      this.list = new ArrayList<>(list);
    }

    public static FieldList of(List<Field> list) {
      return new FieldList(list);
    }

    // The number of declared entries, counting every name of a multi-name field once.
    public int numFields() {
      int n = 0;
      for (Field field : list) {
        n += field.names().isEmpty() ? 1 : field.names().size();
      }
      return n;
    }

    @SyntaxChild
    @Override
    public List<Field> list() {
      return list;
    }
  }

  @SyntaxNode
  public static final class BadExpr extends Expr implements Ast_BadExpr_SyntaxNode {
    private BadExpr() {
      super(Kind.BAD_EXPR);
    }

    public static BadExpr of() {
      return new BadExpr();
    }
  }

  @SyntaxNode
  public static final class Ident extends Expr implements Ast_Ident_SyntaxNode {
    private final String name;

    private Ident(String name) {
      super(Kind.IDENT);
      this.name = Preconditions.checkNotNull(name);
    }

    public static Ident of(String name) {
      return new Ident(name);
    }

    public String name() {
      return name;
    }
  }

  @SyntaxNode
  public static final class BasicLit extends Expr implements Ast_BasicLit_SyntaxNode {
    private final LitKind litKind;
    private final String value;

    private BasicLit(LitKind litKind, String value) {
      super(Kind.BASIC_LIT);
      this.litKind = Preconditions.checkNotNull(litKind);
      this.value = Preconditions.checkNotNull(value);
    }

    public static BasicLit of(LitKind litKind, String value) {
      return new BasicLit(litKind, value);
    }

    public static BasicLit ofInt(long value) {
      return new BasicLit(LitKind.INT, Long.toString(value));
    }

    public static BasicLit ofString(String value) {
      return new BasicLit(LitKind.STRING, "\"" + value + "\"");
    }

    public LitKind litKind() {
      return litKind;
    }

    public String value() {
      return value;
    }
  }

  // ...T in a variadic parameter list.
  @SyntaxNode
  public static final class Ellipsis extends Expr implements Ast_Ellipsis_SyntaxNode {
    private Expr elt;

    private Ellipsis(Expr elt) {
      super(Kind.ELLIPSIS);
      this.elt = elt;
    }

    public static Ellipsis of(Expr elt) {
      return new Ellipsis(elt);
    }

    @SyntaxChild
    @Override
    public Expr elt() {
      return elt;
    }

    @Override
    public void setElt(Expr elt) {
      this.elt = elt;
    }
  }

  @SyntaxNode
  public static final class FuncLit extends Expr implements Ast_FuncLit_SyntaxNode {
    private FuncType type;
    private BlockStmt body;

    private FuncLit(FuncType type, BlockStmt body) {
      super(Kind.FUNC_LIT);
      this.type = type;
      this.body = body;
    }

    public static FuncLit of(FuncType type, BlockStmt body) {
      return new FuncLit(type, body);
    }

    @SyntaxChild
    @Override
    public FuncType type() {
      return type;
    }

    @Override
    public void setType(FuncType type) {
      this.type = type;
    }

    @SyntaxChild
    @Override
    public BlockStmt body() {
      return body;
    }

    @Override
    public void setBody(BlockStmt body) {
      this.body = body;
    }
  }

  @SyntaxNode
  public static final class CompositeLit extends Expr implements Ast_CompositeLit_SyntaxNode {
    private Expr type;
    private final List<Expr> elts;

    private CompositeLit(Expr type, List<Expr> elts) {
      super(Kind.COMPOSITE_LIT);
      this.type = type;
      this.elts = new ArrayList<>(elts);
    }

    public static CompositeLit of(Expr type, List<Expr> elts) {
      return new CompositeLit(type, elts);
    }

    @SyntaxChild
    @Override
    public Expr type() {
      return type;
    }

    @Override
    public void setType(Expr type) {
      this.type = type;
    }

    @SyntaxChild
    @Override
    public List<Expr> elts() {
      return elts;
    }
  }

  @SyntaxNode
  public static final class ParenExpr extends Expr implements Ast_ParenExpr_SyntaxNode {
    private Expr x;

    private ParenExpr(Expr x) {
      super(Kind.PAREN_EXPR);
      this.x = x;
    }

    public static ParenExpr of(Expr x) {
      return new ParenExpr(x);
    }

    @SyntaxChild
    @Override
    public Expr x() {
      return x;
    }

    @Override
    public void setX(Expr x) {
      this.x = x;
    }
  }

  @SyntaxNode
  public static final class SelectorExpr extends Expr implements Ast_SelectorExpr_SyntaxNode {
    private Expr x;
    private Ident sel;

    private SelectorExpr(Expr x, Ident sel) {
      super(Kind.SELECTOR_EXPR);
      this.x = x;
      this.sel = sel;
    }

    public static SelectorExpr of(Expr x, Ident sel) {
      return new SelectorExpr(x, sel);
    }

    @SyntaxChild
    @Override
    public Expr x() {
      return x;
    }

    @Override
    public void setX(Expr x) {
      this.x = x;
    }

    @SyntaxChild
    @Override
    public Ident sel() {
      return sel;
    }

    @Override
    public void setSel(Ident sel) {
      this.sel = sel;
    }
  }

  // x[i], or x[i, j] for receivers with a multi-index element operator.
  @SyntaxNode
  public static final class IndexExpr extends Expr implements Ast_IndexExpr_SyntaxNode {
    private Expr x;
    private final List<Expr> indices;

    private IndexExpr(Expr x, List<Expr> indices) {
      super(Kind.INDEX_EXPR);
      this.x = x;
      this.indices = new ArrayList<>(indices);
    }

    public static IndexExpr of(Expr x, List<Expr> indices) {
      return new IndexExpr(x, indices);
    }

    @SyntaxChild
    @Override
    public Expr x() {
      return x;
    }

    @Override
    public void setX(Expr x) {
      this.x = x;
    }

    @SyntaxChild
    @Override
    public List<Expr> indices() {
      return indices;
    }
  }

  @SyntaxNode
  public static final class SliceExpr extends Expr implements Ast_SliceExpr_SyntaxNode {
    private Expr x;
    private Expr low;
    private Expr high;
    private Expr max;
    private final boolean slice3;

    private SliceExpr(Expr x, Expr low, Expr high, Expr max, boolean slice3) {
      super(Kind.SLICE_EXPR);
      this.x = x;
      this.low = low;
      this.high = high;
      this.max = max;
      this.slice3 = slice3;
    }

    public static SliceExpr of(Expr x, Expr low, Expr high, Expr max, boolean slice3) {
      return new SliceExpr(x, low, high, max, slice3);
    }

    @SyntaxChild
    @Override
    public Expr x() {
      return x;
    }

    @Override
    public void setX(Expr x) {
      this.x = x;
    }

    @SyntaxChild
    @Override
    public Expr low() {
      return low;
    }

    @Override
    public void setLow(Expr low) {
      this.low = low;
    }

    @SyntaxChild
    @Override
    public Expr high() {
      return high;
    }

    @Override
    public void setHigh(Expr high) {
      this.high = high;
    }

    @SyntaxChild
    @Override
    public Expr max() {
      return max;
    }

    @Override
    public void setMax(Expr max) {
      this.max = max;
    }

    public boolean slice3() {
      return slice3;
    }
  }

  // x.(T); a null type stands for x.(type) in a type switch.
  @SyntaxNode
  public static final class TypeAssertExpr extends Expr implements Ast_TypeAssertExpr_SyntaxNode {
    private Expr x;
    private Expr type;

    private TypeAssertExpr(Expr x, Expr type) {
      super(Kind.TYPE_ASSERT_EXPR);
      this.x = x;
      this.type = type;
    }

    public static TypeAssertExpr of(Expr x, Expr type) {
      return new TypeAssertExpr(x, type);
    }

    @SyntaxChild
    @Override
    public Expr x() {
      return x;
    }

    @Override
    public void setX(Expr x) {
      this.x = x;
    }

    @SyntaxChild
    @Override
    public Expr type() {
      return type;
    }

    @Override
    public void setType(Expr type) {
      this.type = type;
    }
  }

  @SyntaxNode
  public static final class CallExpr extends Expr implements Ast_CallExpr_SyntaxNode {
    private Expr fun;
    private final List<Expr> args;
    private final boolean hasEllipsis;

    private CallExpr(Expr fun, List<Expr> args, boolean hasEllipsis) {
      super(Kind.CALL_EXPR);
      this.fun = fun;
      this.args = new ArrayList<>(args);
      this.hasEllipsis = hasEllipsis;
    }

    public static CallExpr of(Expr fun, List<Expr> args, boolean hasEllipsis) {
      return new CallExpr(fun, args, hasEllipsis);
    }

    @SyntaxChild
    @Override
    public Expr fun() {
      return fun;
    }

    @Override
    public void setFun(Expr fun) {
      this.fun = fun;
    }

    @SyntaxChild
    @Override
    public List<Expr> args() {
      return args;
    }

    public boolean hasEllipsis() {
      return hasEllipsis;
    }
  }

  @SyntaxNode
  public static final class StarExpr extends Expr implements Ast_StarExpr_SyntaxNode {
    private Expr x;

    private StarExpr(Expr x) {
      super(Kind.STAR_EXPR);
      this.x = x;
    }

    public static StarExpr of(Expr x) {
      return new StarExpr(x);
    }

    @SyntaxChild
    @Override
    public Expr x() {
      return x;
    }

    @Override
    public void setX(Expr x) {
      this.x = x;
    }
  }

  @SyntaxNode
  public static final class UnaryExpr extends Expr implements Ast_UnaryExpr_SyntaxNode {
    private final Token op;
    private Expr x;

    private UnaryExpr(Token op, Expr x) {
      super(Kind.UNARY_EXPR);
      this.op = Preconditions.checkNotNull(op);
      this.x = x;
    }

    public static UnaryExpr of(Token op, Expr x) {
      return new UnaryExpr(op, x);
    }

    public Token op() {
      return op;
    }

    @SyntaxChild
    @Override
    public Expr x() {
      return x;
    }

    @Override
    public void setX(Expr x) {
      this.x = x;
    }
  }

  @SyntaxNode
  public static final class BinaryExpr extends Expr implements Ast_BinaryExpr_SyntaxNode {
    private Expr x;
    private final Token op;
    private Expr y;

    private BinaryExpr(Expr x, Token op, Expr y) {
      super(Kind.BINARY_EXPR);
      this.x = x;
      this.op = Preconditions.checkNotNull(op);
      this.y = y;
    }

    public static BinaryExpr of(Expr x, Token op, Expr y) {
      return new BinaryExpr(x, op, y);
    }

    @SyntaxChild
    @Override
    public Expr x() {
      return x;
    }

    @Override
    public void setX(Expr x) {
      this.x = x;
    }

    public Token op() {
      return op;
    }

    @SyntaxChild
    @Override
    public Expr y() {
      return y;
    }

    @Override
    public void setY(Expr y) {
      this.y = y;
    }
  }

  @SyntaxNode
  public static final class KeyValueExpr extends Expr implements Ast_KeyValueExpr_SyntaxNode {
    private Expr key;
    private Expr value;

    private KeyValueExpr(Expr key, Expr value) {
      super(Kind.KEY_VALUE_EXPR);
      this.key = key;
      this.value = value;
    }

    public static KeyValueExpr of(Expr key, Expr value) {
      return new KeyValueExpr(key, value);
    }

    @SyntaxChild
    @Override
    public Expr key() {
      return key;
    }

    @Override
    public void setKey(Expr key) {
      this.key = key;
    }

    @SyntaxChild
    @Override
    public Expr value() {
      return value;
    }

    @Override
    public void setValue(Expr value) {
      this.value = value;
    }
  }

  // Array type, or slice type when len is null.
  @SyntaxNode
  public static final class ArrayType extends Expr implements Ast_ArrayType_SyntaxNode {
    private Expr len;
    private Expr elt;

    private ArrayType(Expr len, Expr elt) {
      super(Kind.ARRAY_TYPE);
      this.len = len;
      this.elt = elt;
    }

    public static ArrayType of(Expr len, Expr elt) {
      return new ArrayType(len, elt);
    }

    @SyntaxChild
    @Override
    public Expr len() {
      return len;
    }

    @Override
    public void setLen(Expr len) {
      this.len = len;
    }

    @SyntaxChild
    @Override
    public Expr elt() {
      return elt;
    }

    @Override
    public void setElt(Expr elt) {
      this.elt = elt;
    }
  }

  @SyntaxNode
  public static final class StructType extends Expr implements Ast_StructType_SyntaxNode {
    private FieldList fields;

    private StructType(FieldList fields) {
      super(Kind.STRUCT_TYPE);
      this.fields = fields;
    }

    public static StructType of(FieldList fields) {
      return new StructType(fields);
    }

    @SyntaxChild
    @Override
    public FieldList fields() {
      return fields;
    }

    @Override
    public void setFields(FieldList fields) {
      this.fields = fields;
    }
  }

  @SyntaxNode
  public static final class FuncType extends Expr implements Ast_FuncType_SyntaxNode {
    private FieldList params;
    private FieldList results;

    private FuncType(FieldList params, FieldList results) {
      super(Kind.FUNC_TYPE);
      this.params = params;
      this.results = results;
    }

    public static FuncType of(FieldList params, FieldList results) {
      return new FuncType(params, results);
    }

    @SyntaxChild
    @Override
    public FieldList params() {
      return params;
    }

    @Override
    public void setParams(FieldList params) {
      this.params = params;
    }

    @SyntaxChild
    @Override
    public FieldList results() {
      return results;
    }

    @Override
    public void setResults(FieldList results) {
      this.results = results;
    }
  }

  @SyntaxNode
  public static final class InterfaceType extends Expr implements Ast_InterfaceType_SyntaxNode {
    private FieldList methods;

    private InterfaceType(FieldList methods) {
      super(Kind.INTERFACE_TYPE);
      this.methods = methods;
    }

    public static InterfaceType of(FieldList methods) {
      return new InterfaceType(methods);
    }

    @SyntaxChild
    @Override
    public FieldList methods() {
      return methods;
    }

    @Override
    public void setMethods(FieldList methods) {
      this.methods = methods;
    }
  }

  @SyntaxNode
  public static final class MapType extends Expr implements Ast_MapType_SyntaxNode {
    private Expr key;
    private Expr value;

    private MapType(Expr key, Expr value) {
      super(Kind.MAP_TYPE);
      this.key = key;
      this.value = value;
    }

    public static MapType of(Expr key, Expr value) {
      return new MapType(key, value);
    }

    @SyntaxChild
    @Override
    public Expr key() {
      return key;
    }

    @Override
    public void setKey(Expr key) {
      this.key = key;
    }

    @SyntaxChild
    @Override
    public Expr value() {
      return value;
    }

    @Override
    public void setValue(Expr value) {
      this.value = value;
    }
  }

  @SyntaxNode
  public static final class ChanType extends Expr implements Ast_ChanType_SyntaxNode {
    private final ChanDir dir;
    private Expr value;

    private ChanType(ChanDir dir, Expr value) {
      super(Kind.CHAN_TYPE);
      this.dir = Preconditions.checkNotNull(dir);
      this.value = value;
    }

    public static ChanType of(ChanDir dir, Expr value) {
      return new ChanType(dir, value);
    }

    public ChanDir dir() {
      return dir;
    }

    @SyntaxChild
    @Override
    public Expr value() {
      return value;
    }

    @Override
    public void setValue(Expr value) {
      this.value = value;
    }
  }

  @SyntaxNode
  public static final class BadStmt extends Stmt implements Ast_BadStmt_SyntaxNode {
    private BadStmt() {
      super(Kind.BAD_STMT);
    }

    public static BadStmt of() {
      return new BadStmt();
    }
  }

  @SyntaxNode
  public static final class DeclStmt extends Stmt implements Ast_DeclStmt_SyntaxNode {
    private Decl decl;

    private DeclStmt(Decl decl) {
      super(Kind.DECL_STMT);
      this.decl = decl;
    }

    public static DeclStmt of(Decl decl) {
      return new DeclStmt(decl);
    }

    @SyntaxChild
    @Override
    public Decl decl() {
      return decl;
    }

    @Override
    public void setDecl(Decl decl) {
      this.decl = decl;
    }
  }

  @SyntaxNode
  public static final class EmptyStmt extends Stmt implements Ast_EmptyStmt_SyntaxNode {
    private EmptyStmt() {
      super(Kind.EMPTY_STMT);
    }

    public static EmptyStmt of() {
      return new EmptyStmt();
    }
  }

  @SyntaxNode
  public static final class LabeledStmt extends Stmt implements Ast_LabeledStmt_SyntaxNode {
    private Ident label;
    private Stmt stmt;

    private LabeledStmt(Ident label, Stmt stmt) {
      super(Kind.LABELED_STMT);
      this.label = label;
      this.stmt = stmt;
    }

    public static LabeledStmt of(Ident label, Stmt stmt) {
      return new LabeledStmt(label, stmt);
    }

    @SyntaxChild
    @Override
    public Ident label() {
      return label;
    }

    @Override
    public void setLabel(Ident label) {
      this.label = label;
    }

    @SyntaxChild
    @Override
    public Stmt stmt() {
      return stmt;
    }

    @Override
    public void setStmt(Stmt stmt) {
      this.stmt = stmt;
    }
  }

  @SyntaxNode
  public static final class ExprStmt extends Stmt implements Ast_ExprStmt_SyntaxNode {
    private Expr x;

    private ExprStmt(Expr x) {
      super(Kind.EXPR_STMT);
      this.x = x;
    }

    public static ExprStmt of(Expr x) {
      return new ExprStmt(x);
    }

    @SyntaxChild
    @Override
    public Expr x() {
      return x;
    }

    @Override
    public void setX(Expr x) {
      this.x = x;
    }
  }

  @SyntaxNode
  public static final class SendStmt extends Stmt implements Ast_SendStmt_SyntaxNode {
    private Expr chan;
    private Expr value;

    private SendStmt(Expr chan, Expr value) {
      super(Kind.SEND_STMT);
      this.chan = chan;
      this.value = value;
    }

    public static SendStmt of(Expr chan, Expr value) {
      return new SendStmt(chan, value);
    }

    @SyntaxChild
    @Override
    public Expr chan() {
      return chan;
    }

    @Override
    public void setChan(Expr chan) {
      this.chan = chan;
    }

    @SyntaxChild
    @Override
    public Expr value() {
      return value;
    }

    @Override
    public void setValue(Expr value) {
      this.value = value;
    }
  }

  @SyntaxNode
  public static final class IncDecStmt extends Stmt implements Ast_IncDecStmt_SyntaxNode {
    private Expr x;
    private final Token tok;

    private IncDecStmt(Expr x, Token tok) {
      super(Kind.INC_DEC_STMT);
      this.x = x;
      this.tok = Preconditions.checkNotNull(tok);
    }

    public static IncDecStmt of(Expr x, Token tok) {
      return new IncDecStmt(x, tok);
    }

    @SyntaxChild
    @Override
    public Expr x() {
      return x;
    }

    @Override
    public void setX(Expr x) {
      this.x = x;
    }

    public Token tok() {
      return tok;
    }
  }

  // Assignment or short variable declaration; tok is =, := or a compound assignment.
  @SyntaxNode
  public static final class AssignStmt extends Stmt implements Ast_AssignStmt_SyntaxNode {
    private final List<Expr> lhs;
    private final Token tok;
    private final List<Expr> rhs;

    private AssignStmt(List<Expr> lhs, Token tok, List<Expr> rhs) {
      super(Kind.ASSIGN_STMT);
      this.lhs = new ArrayList<>(lhs);
      this.tok = Preconditions.checkNotNull(tok);
      this.rhs = new ArrayList<>(rhs);
    }

    public static AssignStmt of(List<Expr> lhs, Token tok, List<Expr> rhs) {
      return new AssignStmt(lhs, tok, rhs);
    }

    public static AssignStmt of(Expr lhs, Token tok, Expr rhs) {
      return new AssignStmt(ImmutableList.of(lhs), tok, ImmutableList.of(rhs));
    }

    @SyntaxChild
    @Override
    public List<Expr> lhs() {
      return lhs;
    }

    public Token tok() {
      return tok;
    }

    @SyntaxChild
    @Override
    public List<Expr> rhs() {
      return rhs;
    }
  }

  @SyntaxNode
  public static final class GoStmt extends Stmt implements Ast_GoStmt_SyntaxNode {
    private CallExpr call;

    private GoStmt(CallExpr call) {
      super(Kind.GO_STMT);
      this.call = call;
    }

    public static GoStmt of(CallExpr call) {
      return new GoStmt(call);
    }

    @SyntaxChild
    @Override
    public CallExpr call() {
      return call;
    }

    @Override
    public void setCall(CallExpr call) {
      this.call = call;
    }
  }

  @SyntaxNode
  public static final class DeferStmt extends Stmt implements Ast_DeferStmt_SyntaxNode {
    private CallExpr call;

    private DeferStmt(CallExpr call) {
      super(Kind.DEFER_STMT);
      this.call = call;
    }

    public static DeferStmt of(CallExpr call) {
      return new DeferStmt(call);
    }

    @SyntaxChild
    @Override
    public CallExpr call() {
      return call;
    }

    @Override
    public void setCall(CallExpr call) {
      this.call = call;
    }
  }

  @SyntaxNode
  public static final class ReturnStmt extends Stmt implements Ast_ReturnStmt_SyntaxNode {
    private final List<Expr> results;

    private ReturnStmt(List<Expr> results) {
      super(Kind.RETURN_STMT);
      this.results = new ArrayList<>(results);
    }

    public static ReturnStmt of(List<Expr> results) {
      return new ReturnStmt(results);
    }

    @SyntaxChild
    @Override
    public List<Expr> results() {
      return results;
    }
  }

  @SyntaxNode
  public static final class BranchStmt extends Stmt implements Ast_BranchStmt_SyntaxNode {
    private final Token tok;
    private Ident label;

    private BranchStmt(Token tok, Ident label) {
      super(Kind.BRANCH_STMT);
      this.tok = Preconditions.checkNotNull(tok);
      this.label = label;
    }

    public static BranchStmt of(Token tok, Ident label) {
      return new BranchStmt(tok, label);
    }

    public Token tok() {
      return tok;
    }

    @SyntaxChild
    @Override
    public Ident label() {
      return label;
    }

    @Override
    public void setLabel(Ident label) {
      this.label = label;
    }
  }

  @SyntaxNode
  public static final class BlockStmt extends Stmt implements Ast_BlockStmt_SyntaxNode {
    private final List<Stmt> list;

    private BlockStmt(List<Stmt> list) {
      super(Kind.BLOCK_STMT);
      this.list = new ArrayList<>(list);
    }

    public static BlockStmt of(List<Stmt> list) {
      return new BlockStmt(list);
    }

    @SyntaxChild
    @Override
    public List<Stmt> list() {
      return list;
    }
  }

  @SyntaxNode
  public static final class IfStmt extends Stmt implements Ast_IfStmt_SyntaxNode {
    private Stmt init;
    private Expr cond;
    private BlockStmt body;
    private Stmt els;

    private IfStmt(Stmt init, Expr cond, BlockStmt body, Stmt els) {
      super(Kind.IF_STMT);
      this.init = init;
      this.cond = cond;
      this.body = body;
      this.els = els;
    }

    public static IfStmt of(Stmt init, Expr cond, BlockStmt body, Stmt els) {
      return new IfStmt(init, cond, body, els);
    }

    @SyntaxChild
    @Override
    public Stmt init() {
      return init;
    }

    @Override
    public void setInit(Stmt init) {
      this.init = init;
    }

    @SyntaxChild
    @Override
    public Expr cond() {
      return cond;
    }

    @Override
    public void setCond(Expr cond) {
      this.cond = cond;
    }

    @SyntaxChild
    @Override
    public BlockStmt body() {
      return body;
    }

    @Override
    public void setBody(BlockStmt body) {
      this.body = body;
    }

    @SyntaxChild
    @Override
    public Stmt els() {
      return els;
    }

    @Override
    public void setEls(Stmt els) {
      this.els = els;
    }
  }

  // A switch case; the default case has an empty expression list.
  @SyntaxNode
  public static final class CaseClause extends Stmt implements Ast_CaseClause_SyntaxNode {
    private final List<Expr> list;
    private final boolean isDefault;
    private final List<Stmt> body;

    private CaseClause(List<Expr> list, boolean isDefault, List<Stmt> body) {
      super(Kind.CASE_CLAUSE);
      this.list = new ArrayList<>(list);
      this.isDefault = isDefault;
      this.body = new ArrayList<>(body);
    }

    public static CaseClause of(List<Expr> list, boolean isDefault, List<Stmt> body) {
      return new CaseClause(list, isDefault, body);
    }

    @SyntaxChild
    @Override
    public List<Expr> list() {
      return list;
    }

    public boolean isDefault() {
      return isDefault;
    }

    @SyntaxChild
    @Override
    public List<Stmt> body() {
      return body;
    }
  }

  @SyntaxNode
  public static final class SwitchStmt extends Stmt implements Ast_SwitchStmt_SyntaxNode {
    private Stmt init;
    private Expr tag;
    private BlockStmt body;

    private SwitchStmt(Stmt init, Expr tag, BlockStmt body) {
      super(Kind.SWITCH_STMT);
      this.init = init;
      this.tag = tag;
      this.body = body;
    }

    public static SwitchStmt of(Stmt init, Expr tag, BlockStmt body) {
      return new SwitchStmt(init, tag, body);
    }

    @SyntaxChild
    @Override
    public Stmt init() {
      return init;
    }

    @Override
    public void setInit(Stmt init) {
      this.init = init;
    }

    @SyntaxChild
    @Override
    public Expr tag() {
      return tag;
    }

    @Override
    public void setTag(Expr tag) {
      this.tag = tag;
    }

    @SyntaxChild
    @Override
    public BlockStmt body() {
      return body;
    }

    @Override
    public void setBody(BlockStmt body) {
      this.body = body;
    }
  }

  @SyntaxNode
  public static final class TypeSwitchStmt extends Stmt implements Ast_TypeSwitchStmt_SyntaxNode {
    private Stmt init;
    private Stmt assign;
    private BlockStmt body;

    private TypeSwitchStmt(Stmt init, Stmt assign, BlockStmt body) {
      super(Kind.TYPE_SWITCH_STMT);
      this.init = init;
      this.assign = assign;
      this.body = body;
    }

    public static TypeSwitchStmt of(Stmt init, Stmt assign, BlockStmt body) {
      return new TypeSwitchStmt(init, assign, body);
    }

    @SyntaxChild
    @Override
    public Stmt init() {
      return init;
    }

    @Override
    public void setInit(Stmt init) {
      this.init = init;
    }

    @SyntaxChild
    @Override
    public Stmt assign() {
      return assign;
    }

    @Override
    public void setAssign(Stmt assign) {
      this.assign = assign;
    }

    @SyntaxChild
    @Override
    public BlockStmt body() {
      return body;
    }

    @Override
    public void setBody(BlockStmt body) {
      this.body = body;
    }
  }

  // A select case; the default case has a null comm.
  @SyntaxNode
  public static final class CommClause extends Stmt implements Ast_CommClause_SyntaxNode {
    private Stmt comm;
    private final List<Stmt> body;

    private CommClause(Stmt comm, List<Stmt> body) {
      super(Kind.COMM_CLAUSE);
      this.comm = comm;
      this.body = new ArrayList<>(body);
    }

    public static CommClause of(Stmt comm, List<Stmt> body) {
      return new CommClause(comm, body);
    }

    @SyntaxChild
    @Override
    public Stmt comm() {
      return comm;
    }

    @Override
    public void setComm(Stmt comm) {
      this.comm = comm;
    }

    @SyntaxChild
    @Override
    public List<Stmt> body() {
      return body;
    }
  }

  @SyntaxNode
  public static final class SelectStmt extends Stmt implements Ast_SelectStmt_SyntaxNode {
    private BlockStmt body;

    private SelectStmt(BlockStmt body) {
      super(Kind.SELECT_STMT);
      this.body = body;
    }

    public static SelectStmt of(BlockStmt body) {
      return new SelectStmt(body);
    }

    @SyntaxChild
    @Override
    public BlockStmt body() {
      return body;
    }

    @Override
    public void setBody(BlockStmt body) {
      this.body = body;
    }
  }

  @SyntaxNode
  public static final class ForStmt extends Stmt implements Ast_ForStmt_SyntaxNode {
    private Stmt init;
    private Expr cond;
    private Stmt post;
    private BlockStmt body;

    private ForStmt(Stmt init, Expr cond, Stmt post, BlockStmt body) {
      super(Kind.FOR_STMT);
      this.init = init;
      this.cond = cond;
      this.post = post;
      this.body = body;
    }

    public static ForStmt of(Stmt init, Expr cond, Stmt post, BlockStmt body) {
      return new ForStmt(init, cond, post, body);
    }

    @SyntaxChild
    @Override
    public Stmt init() {
      return init;
    }

    @Override
    public void setInit(Stmt init) {
      this.init = init;
    }

    @SyntaxChild
    @Override
    public Expr cond() {
      return cond;
    }

    @Override
    public void setCond(Expr cond) {
      this.cond = cond;
    }

    @SyntaxChild
    @Override
    public Stmt post() {
      return post;
    }

    @Override
    public void setPost(Stmt post) {
      this.post = post;
    }

    @SyntaxChild
    @Override
    public BlockStmt body() {
      return body;
    }

    @Override
    public void setBody(BlockStmt body) {
      this.body = body;
    }
  }

  @SyntaxNode
  public static final class RangeStmt extends Stmt implements Ast_RangeStmt_SyntaxNode {
    private Expr key;
    private Expr value;
    private final Token tok;
    private Expr x;
    private BlockStmt body;

    private RangeStmt(Expr key, Expr value, Token tok, Expr x, BlockStmt body) {
      super(Kind.RANGE_STMT);
      this.key = key;
      this.value = value;
      this.tok = Preconditions.checkNotNull(tok);
      this.x = x;
      this.body = body;
    }

    public static RangeStmt of(Expr key, Expr value, Token tok, Expr x, BlockStmt body) {
      return new RangeStmt(key, value, tok, x, body);
    }

    @SyntaxChild
    @Override
    public Expr key() {
      return key;
    }

    @Override
    public void setKey(Expr key) {
      this.key = key;
    }

    @SyntaxChild
    @Override
    public Expr value() {
      return value;
    }

    @Override
    public void setValue(Expr value) {
      this.value = value;
    }

    public Token tok() {
      return tok;
    }

    @SyntaxChild
    @Override
    public Expr x() {
      return x;
    }

    @Override
    public void setX(Expr x) {
      this.x = x;
    }

    @SyntaxChild
    @Override
    public BlockStmt body() {
      return body;
    }

    @Override
    public void setBody(BlockStmt body) {
      this.body = body;
    }
  }

  @SyntaxNode
  public static final class ImportSpec extends Spec implements Ast_ImportSpec_SyntaxNode {
    private CommentGroup doc;
    private Ident name;
    private BasicLit path;
    private CommentGroup comment;

    private ImportSpec(CommentGroup doc, Ident name, BasicLit path, CommentGroup comment) {
      super(Kind.IMPORT_SPEC);
      this.doc = doc;
      this.name = name;
      this.path = path;
      this.comment = comment;
    }

    public static ImportSpec of(CommentGroup doc, Ident name, BasicLit path, CommentGroup comment) {
      return new ImportSpec(doc, name, path, comment);
    }

    @SyntaxChild
    @Override
    public CommentGroup doc() {
      return doc;
    }

    @Override
    public void setDoc(CommentGroup doc) {
      this.doc = doc;
    }

    @SyntaxChild
    @Override
    public Ident name() {
      return name;
    }

    @Override
    public void setName(Ident name) {
      this.name = name;
    }

    @SyntaxChild
    @Override
    public BasicLit path() {
      return path;
    }

    @Override
    public void setPath(BasicLit path) {
      this.path = path;
    }

    @SyntaxChild
    @Override
    public CommentGroup comment() {
      return comment;
    }

    @Override
    public void setComment(CommentGroup comment) {
      this.comment = comment;
    }
  }

  @SyntaxNode
  public static final class ValueSpec extends Spec implements Ast_ValueSpec_SyntaxNode {
    private CommentGroup doc;
    private final List<Ident> names;
    private Expr type;
    private final List<Expr> values;
    private CommentGroup comment;

    private ValueSpec(
        CommentGroup doc,
        List<Ident> names,
        Expr type,
        List<Expr> values,
        CommentGroup comment) {
      super(Kind.VALUE_SPEC);
      this.doc = doc;
      this.names = new ArrayList<>(names);
      this.type = type;
      this.values = new ArrayList<>(values);
      this.comment = comment;
    }

    public static ValueSpec of(
        CommentGroup doc,
        List<Ident> names,
        Expr type,
        List<Expr> values,
        CommentGroup comment) {
      return new ValueSpec(doc, names, type, values, comment);
    }

    @SyntaxChild
    @Override
    public CommentGroup doc() {
      return doc;
    }

    @Override
    public void setDoc(CommentGroup doc) {
      this.doc = doc;
    }

    @SyntaxChild
    @Override
    public List<Ident> names() {
      return names;
    }

    @SyntaxChild
    @Override
    public Expr type() {
      return type;
    }

    @Override
    public void setType(Expr type) {
      this.type = type;
    }

    @SyntaxChild
    @Override
    public List<Expr> values() {
      return values;
    }

    @SyntaxChild
    @Override
    public CommentGroup comment() {
      return comment;
    }

    @Override
    public void setComment(CommentGroup comment) {
      this.comment = comment;
    }
  }

  @SyntaxNode
  public static final class TypeSpec extends Spec implements Ast_TypeSpec_SyntaxNode {
    private CommentGroup doc;
    private Ident name;
    private Expr type;
    private CommentGroup comment;

    private TypeSpec(CommentGroup doc, Ident name, Expr type, CommentGroup comment) {
      super(Kind.TYPE_SPEC);
      this.doc = doc;
      this.name = name;
      this.type = type;
      this.comment = comment;
    }

    public static TypeSpec of(CommentGroup doc, Ident name, Expr type, CommentGroup comment) {
      return new TypeSpec(doc, name, type, comment);
    }

    @SyntaxChild
    @Override
    public CommentGroup doc() {
      return doc;
    }

    @Override
    public void setDoc(CommentGroup doc) {
      this.doc = doc;
    }

    @SyntaxChild
    @Override
    public Ident name() {
      return name;
    }

    @Override
    public void setName(Ident name) {
      this.name = name;
    }

    @SyntaxChild
    @Override
    public Expr type() {
      return type;
    }

    @Override
    public void setType(Expr type) {
      this.type = type;
    }

    @SyntaxChild
    @Override
    public CommentGroup comment() {
      return comment;
    }

    @Override
    public void setComment(CommentGroup comment) {
      this.comment = comment;
    }
  }

  @SyntaxNode
  public static final class BadDecl extends Decl implements Ast_BadDecl_SyntaxNode {
    private BadDecl() {
      super(Kind.BAD_DECL);
    }

    public static BadDecl of() {
      return new BadDecl();
    }
  }

  @SyntaxNode
  public static final class GenDecl extends Decl implements Ast_GenDecl_SyntaxNode {
    private CommentGroup doc;
    private final Token tok;
    private final List<Spec> specs;

    private GenDecl(CommentGroup doc, Token tok, List<Spec> specs) {
      super(Kind.GEN_DECL);
      this.doc = doc;
      this.tok = Preconditions.checkNotNull(tok);
      this.specs = new ArrayList<>(specs);
    }

    public static GenDecl of(CommentGroup doc, Token tok, List<Spec> specs) {
      return new GenDecl(doc, tok, specs);
    }

    @SyntaxChild
    @Override
    public CommentGroup doc() {
      return doc;
    }

    @Override
    public void setDoc(CommentGroup doc) {
      this.doc = doc;
    }

    public Token tok() {
      return tok;
    }

    @SyntaxChild
    @Override
    public List<Spec> specs() {
      return specs;
    }
  }

  // A function, or a method when recv is set.
  @SyntaxNode
  public static final class FuncDecl extends Decl implements Ast_FuncDecl_SyntaxNode {
    private CommentGroup doc;
    private FieldList recv;
    private Ident name;
    private FuncType type;
    private BlockStmt body;

    private FuncDecl(CommentGroup doc, FieldList recv, Ident name, FuncType type, BlockStmt body) {
      super(Kind.FUNC_DECL);
      this.doc = doc;
      this.recv = recv;
      this.name = name;
      this.type = type;
      this.body = body;
    }

    public static FuncDecl of(
        CommentGroup doc,
        FieldList recv,
        Ident name,
        FuncType type,
        BlockStmt body) {
      return new FuncDecl(doc, recv, name, type, body);
    }

    public boolean isMethod() {
      return recv != null;
    }

    @SyntaxChild
    @Override
    public CommentGroup doc() {
      return doc;
    }

    @Override
    public void setDoc(CommentGroup doc) {
      this.doc = doc;
    }

    @SyntaxChild
    @Override
    public FieldList recv() {
      return recv;
    }

    @Override
    public void setRecv(FieldList recv) {
      this.recv = recv;
    }

    @SyntaxChild
    @Override
    public Ident name() {
      return name;
    }

    @Override
    public void setName(Ident name) {
      this.name = name;
    }

    @SyntaxChild
    @Override
    public FuncType type() {
      return type;
    }

    @Override
    public void setType(FuncType type) {
      this.type = type;
    }

    @SyntaxChild
    @Override
    public BlockStmt body() {
      return body;
    }

    @Override
    public void setBody(BlockStmt body) {
      this.body = body;
    }
  }

  @SyntaxNode
  public static final class File extends Node implements Ast_File_SyntaxNode {
    private final String fileName;
    private CommentGroup doc;
    private Ident name;
    private final List<Decl> decls;

    private File(String fileName, CommentGroup doc, Ident name, List<Decl> decls) {
      super(Kind.FILE);
      this.fileName = Preconditions.checkNotNull(fileName);
      this.doc = doc;
      this.name = name;
      this.decls = new ArrayList<>(decls);
    }

    public static File of(String fileName, CommentGroup doc, Ident name, List<Decl> decls) {
      return new File(fileName, doc, name, decls);
    }

    public String fileName() {
      return fileName;
    }

    @SyntaxChild
    @Override
    public CommentGroup doc() {
      return doc;
    }

    @Override
    public void setDoc(CommentGroup doc) {
      this.doc = doc;
    }

    @SyntaxChild
    @Override
    public Ident name() {
      return name;
    }

    @Override
    public void setName(Ident name) {
      this.name = name;
    }

    @SyntaxChild
    @Override
    public List<Decl> decls() {
      return decls;
    }
  }

  @SyntaxNode
  public static final class Package extends Node implements Ast_Package_SyntaxNode {
    private final String name;
    private final List<File> files;

    private Package(String name, List<File> files) {
      super(Kind.PACKAGE);
      this.name = Preconditions.checkNotNull(name);
      this.files = new ArrayList<>(files);
    }

    public static Package of(String name, List<File> files) {
      return new Package(name, files);
    }

    public String name() {
      return name;
    }

    @SyntaxChild
    @Override
    public List<File> files() {
      return files;
    }
  }

  // Lets apply replace the root like any other child.
  @SyntaxNode
  public static final class TreeRoot extends Node implements Ast_TreeRoot_SyntaxNode {
    private Node node;

    private TreeRoot(Node node) {
      super(Kind.TREE_ROOT);
      this.node = node;
    }

    public static TreeRoot of(Node node) {
      return new TreeRoot(node);
    }

    @SyntaxChild
    @Override
    public Node node() {
      return node;
    }

    @Override
    public void setNode(Node node) {
      this.node = node;
    }
  }

  private Ast() {}
}
