package opsugar.processor;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.tools.Diagnostic.Kind;
import javax.tools.JavaFileObject;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

@AutoService(Processor.class)
public class SyntaxNodeProcessor extends AbstractProcessor {

  private static final String PACKAGE = "opsugar";

  private static final ClassName NODE_INTERFACE_NAME =
      ClassName.get(PACKAGE, "SyntaxNodeInterface");
  private static final ClassName SYNTAX_VISITOR_NAME = ClassName.get(PACKAGE, "SyntaxVisitor");
  private static final ClassName SLOT_WALKER_NAME = ClassName.get(PACKAGE, "SlotWalker");
  private static final ClassName NODE_UTILS_NAME = ClassName.get(PACKAGE, "SyntaxNodeUtils");
  private static final ClassName IMMUTABLE_LIST_NAME = ClassName.get(ImmutableList.class);
  private static final TypeVariableName V = TypeVariableName.get("V");

  private final Set<String> allSyntaxNodes = new TreeSet<>();
  private boolean visitorsWritten = false;

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(SyntaxNode.class.getName(), SyntaxChild.class.getName());
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    try {
      if (!roundEnv.processingOver() && !annotations.isEmpty()) {
        processImpl(roundEnv);
        if (!visitorsWritten && !allSyntaxNodes.isEmpty()) {
          generateVisitorFiles();
          visitorsWritten = true;
        }
      }
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }

    return true;
  }

  // A single slot, in declaration order.
  private static final class Slot {
    private final String name;
    private final TypeName accessorType;
    private final ClassName category;
    private final boolean sequence;

    private Slot(String name, TypeName accessorType, ClassName category, boolean sequence) {
      this.name = name;
      this.accessorType = accessorType;
      this.category = category;
      this.sequence = sequence;
    }

    private String setterName() {
      return "set" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
  }

  @FunctionalInterface
  private static interface TypeRenderer {
    String renderType(String typeName);
  }

  private void writeFile(String name, String format, TypeRenderer typeRenderer, String joiner)
      throws IOException {
    JavaFileObject file = processingEnv.getFiler().createSourceFile(PACKAGE + "." + name);
    try (Writer wr = file.openWriter()) {
      wr.append(
          String.format(
              format,
              allSyntaxNodes
                  .stream()
                  .map(typeRenderer::renderType)
                  .collect(Collectors.joining(joiner))));
    }
  }

  private void generateVisitorFiles() throws IOException {
    writeFile(
        "SyntaxVisitor",
        "package opsugar;\n\npublic interface SyntaxVisitor<V> {\n\n%s\n\n}\n",
        typeName -> String.format("  V visit(%s node, V value);", typeName),
        "\n\n");
    writeFile(
        "DefaultSyntaxVisitor",
        "package opsugar;\n\n"
            + "public abstract class DefaultSyntaxVisitor<V> implements SyntaxVisitor<V> {\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public V visit(%s node, V value) {\n"
                    + "    return node.visitChildren(this, value);\n"
                    + "  }",
                typeName),
        "\n\n");
    writeFile(
        "VoidDefaultSyntaxVisitor",
        "package opsugar;\n\n"
            + "public abstract class VoidDefaultSyntaxVisitor extends DefaultSyntaxVisitor<Void> {\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public final Void visit(%s node, Void value) {\n"
                    + "    visitImpl(node);\n"
                    + "    return null;\n"
                    + "  }\n\n"
                    + "  public void visitImpl(%s node) {\n"
                    + "    node.visitChildren(this, null);\n"
                    + "  }",
                typeName, typeName),
        "\n\n");
    writeFile(
        "SyntaxKinds",
        "package opsugar;\n\n"
            + "import com.google.common.collect.ImmutableSet;\n\n"
            + "public final class SyntaxKinds {\n\n"
            + "  private static final ImmutableSet<Class<? extends SyntaxNodeInterface>> KINDS =\n"
            + "      ImmutableSet.<Class<? extends SyntaxNodeInterface>>builder()\n"
            + "%s\n"
            + "          .build();\n\n"
            + "  public static ImmutableSet<Class<? extends SyntaxNodeInterface>> all() {\n"
            + "    return KINDS;\n"
            + "  }\n\n"
            + "  public static boolean isRegistered(SyntaxNodeInterface node) {\n"
            + "    return KINDS.contains(node.getClass());\n"
            + "  }\n\n"
            + "  private SyntaxKinds() {}\n"
            + "}\n",
        typeName -> String.format("          .add(%s.class)", typeName),
        "\n");
  }

  private static String getSyntaxNodeInterfaceName(Element element) {
    Deque<String> elems = new ArrayDeque<>();
    elems.push("SyntaxNode");
    do {
      if (element.getKind() == ElementKind.CLASS) {
        elems.addFirst(element.getSimpleName().toString());
      }
      element = element.getEnclosingElement();
    } while (element.getKind() != ElementKind.PACKAGE);
    return elems.stream().collect(Collectors.joining("_"));
  }

  private boolean isList(TypeMirror type) {
    TypeMirror erased = processingEnv.getTypeUtils().erasure(type);
    return erased.toString().equals(List.class.getName());
  }

  private ClassName categoryOf(TypeMirror type, Element where) {
    if (type.getKind() != TypeKind.DECLARED) {
      processingEnv.getMessager().printMessage(Kind.ERROR, "Slot type must be a class", where);
      return NODE_INTERFACE_NAME;
    }
    return ClassName.get((TypeElement) ((DeclaredType) type).asElement());
  }

  private List<Slot> collectSlots(TypeElement element) {
    List<Slot> slots = new ArrayList<>();
    Set<String> methodNames = new TreeSet<>();
    for (Element maybeMethod : element.getEnclosedElements()) {
      if (maybeMethod.getKind() == ElementKind.METHOD) {
        methodNames.add(maybeMethod.getSimpleName().toString());
      }
    }

    for (Element maybeMethod : element.getEnclosedElements()) {
      if (maybeMethod.getKind() != ElementKind.METHOD) continue;
      if (maybeMethod.getAnnotation(SyntaxChild.class) == null) continue;
      if (maybeMethod.getAnnotation(Override.class) == null) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "Missing @Override", maybeMethod);
      }

      ExecutableElement method = (ExecutableElement) maybeMethod;
      TypeMirror returnType = method.getReturnType();
      String name = method.getSimpleName().toString();
      Slot slot;
      if (isList(returnType)) {
        List<? extends TypeMirror> args = ((DeclaredType) returnType).getTypeArguments();
        if (args.size() != 1) {
          processingEnv.getMessager().printMessage(Kind.ERROR, "Raw sequence slot", method);
          continue;
        }
        slot = new Slot(name, TypeName.get(returnType), categoryOf(args.get(0), method), true);
      } else {
        slot = new Slot(name, TypeName.get(returnType), categoryOf(returnType, method), false);
        if (!methodNames.contains(slot.setterName())) {
          processingEnv
              .getMessager()
              .printMessage(Kind.ERROR, "Missing setter: " + slot.setterName(), method);
        }
      }
      slots.add(slot);
    }
    return slots;
  }

  private MethodSpec.Builder overrideBuilder(String name) {
    return MethodSpec.methodBuilder(name)
        .addAnnotation(Override.class)
        .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT);
  }

  private void writeSyntaxNodeFile(TypeElement element) throws IOException {
    String interfaceName = getSyntaxNodeInterfaceName(element);
    if (!element
        .getInterfaces()
        .stream()
        .anyMatch(i -> i.toString().endsWith(interfaceName))) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "Missing interface: " + interfaceName, element);
      return;
    }

    List<Slot> slots = collectSlots(element);
    String qualifiedName = element.getQualifiedName().toString();

    TypeSpec.Builder typeSpecBuilder =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(NODE_INTERFACE_NAME);

    for (Slot slot : slots) {
      typeSpecBuilder.addMethod(
          MethodSpec.methodBuilder(slot.name)
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(slot.accessorType)
              .build());
      if (!slot.sequence) {
        typeSpecBuilder.addMethod(
            MethodSpec.methodBuilder(slot.setterName())
                .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
                .addParameter(ParameterSpec.builder(slot.accessorType, slot.name).build())
                .build());
      }
    }

    ParameterizedTypeName visitorType = ParameterizedTypeName.get(SYNTAX_VISITOR_NAME, V);
    typeSpecBuilder.addMethod(
        overrideBuilder("accept")
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitorType, "visitor")
            .addParameter(V, "value")
            .addStatement("return visitor.visit(($L) this, value)", qualifiedName)
            .build());

    MethodSpec.Builder visitChildren =
        overrideBuilder("visitChildren")
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitorType, "visitor")
            .addParameter(V, "value");
    for (Slot slot : slots) {
      visitChildren.addStatement(
          "value = $T.accept($L(), visitor, value)", NODE_UTILS_NAME, slot.name);
    }
    typeSpecBuilder.addMethod(visitChildren.addStatement("return value").build());

    typeSpecBuilder.addMethod(
        overrideBuilder("slotNames")
            .returns(ParameterizedTypeName.get(IMMUTABLE_LIST_NAME, ClassName.get(String.class)))
            .addStatement(
                "return $T.of($L)",
                IMMUTABLE_LIST_NAME,
                slots
                    .stream()
                    .map(s -> CodeBlock.of("$S", s.name).toString())
                    .collect(Collectors.joining(", ")))
            .build());

    MethodSpec.Builder walkChildren =
        overrideBuilder("walkChildren")
            .returns(TypeName.BOOLEAN)
            .addParameter(SLOT_WALKER_NAME, "walker");
    for (Slot slot : slots) {
      if (slot.sequence) {
        walkChildren
            .beginControlFlow("for (int i = 0; i < $L().size(); i++)", slot.name)
            .addStatement("if (!walker.walk(this, $S, i)) return false", slot.name)
            .endControlFlow();
      } else {
        walkChildren.addStatement("if (!walker.walk(this, $S, -1)) return false", slot.name);
      }
    }
    typeSpecBuilder.addMethod(walkChildren.addStatement("return true").build());

    CodeBlock.Builder childCode = CodeBlock.builder().beginControlFlow("switch (slot)");
    CodeBlock.Builder setChildCode = CodeBlock.builder().beginControlFlow("switch (slot)");
    for (Slot slot : slots) {
      childCode.add("case $S:\n", slot.name).indent();
      setChildCode.add("case $S:\n", slot.name).indent();
      if (slot.sequence) {
        childCode.addStatement(
            "return $T.element(this, slot, index, $L())", NODE_UTILS_NAME, slot.name);
        setChildCode.addStatement(
            "$T.setElement($T.class, this, slot, index, $L(), node)",
            NODE_UTILS_NAME,
            slot.category,
            slot.name);
      } else {
        childCode
            .addStatement("$T.checkSingleSlot(this, slot, index)", NODE_UTILS_NAME)
            .addStatement("return $L()", slot.name);
        setChildCode
            .addStatement("$T.checkSingleSlot(this, slot, index)", NODE_UTILS_NAME)
            .addStatement(
                "$L($T.checkCategory($T.class, this, slot, node))",
                slot.setterName(),
                NODE_UTILS_NAME,
                slot.category);
      }
      setChildCode.addStatement("return");
      childCode.unindent();
      setChildCode.unindent();
    }
    for (CodeBlock.Builder code : ImmutableList.of(childCode, setChildCode)) {
      code.add("default:\n")
          .indent()
          .addStatement("throw $T.noSuchSlot(this, slot)", NODE_UTILS_NAME)
          .unindent()
          .endControlFlow();
    }

    typeSpecBuilder.addMethod(
        overrideBuilder("child")
            .returns(NODE_INTERFACE_NAME)
            .addParameter(String.class, "slot")
            .addParameter(TypeName.INT, "index")
            .addCode(childCode.build())
            .build());
    typeSpecBuilder.addMethod(
        overrideBuilder("setChild")
            .addParameter(String.class, "slot")
            .addParameter(TypeName.INT, "index")
            .addParameter(NODE_INTERFACE_NAME, "node")
            .addCode(setChildCode.build())
            .build());

    JavaFile javaFile = JavaFile.builder(PACKAGE, typeSpecBuilder.build()).build();
    JavaFileObject file =
        processingEnv.getFiler().createSourceFile(PACKAGE + "." + interfaceName, element);
    try (Writer wr = file.openWriter()) {
      wr.append(javaFile.toString());
    }
  }

  private void processImpl(RoundEnvironment roundEnv) throws IOException {
    for (Element element : roundEnv.getElementsAnnotatedWith(SyntaxNode.class)) {
      TypeElement typeElement = (TypeElement) element;
      if (typeElement.getModifiers().contains(Modifier.ABSTRACT)) {
        processingEnv
            .getMessager()
            .printMessage(Kind.ERROR, "Syntax node kinds must be concrete", typeElement);
        continue;
      }
      try {
        writeSyntaxNodeFile(typeElement);
      } catch (Exception ex) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, typeElement);
      }

      allSyntaxNodes.add(typeElement.getQualifiedName().toString());
    }
  }
}
