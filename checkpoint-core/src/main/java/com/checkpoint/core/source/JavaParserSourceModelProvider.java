package com.checkpoint.core.source;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link SourceModelProvider} for Java sources, backed by JavaParser.
 *
 * <p>Works on syntax only: receivers are reported by their simple name and no
 * symbol resolution is attempted.</p>
 */
public class JavaParserSourceModelProvider implements SourceModelProvider {

    private static final Logger log = LoggerFactory.getLogger(JavaParserSourceModelProvider.class);

    private final JavaParser javaParser;

    public JavaParserSourceModelProvider() {
        this.javaParser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    @Override
    public Optional<SourceModel> parse(String location, String content) {
        ParseResult<CompilationUnit> result;
        synchronized (javaParser) {
            result = javaParser.parse(content);
        }
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            log.debug("Failed to parse Java source: {}", location);
            result.getProblems().forEach(problem -> log.debug("  - {}", problem));
            return Optional.empty();
        }

        CompilationUnit cu = result.getResult().get();
        return Optional.of(new SourceModel(
            location,
            content,
            extractImports(cu),
            extractSymbols(cu),
            extractCalls(cu),
            extractMemberReferences(cu)
        ));
    }

    private List<String> extractImports(CompilationUnit cu) {
        List<String> imports = new ArrayList<>();
        for (ImportDeclaration declaration : cu.getImports()) {
            imports.add(declaration.getNameAsString() + (declaration.isAsterisk() ? ".*" : ""));
        }
        return imports;
    }

    private List<SymbolInfo> extractSymbols(CompilationUnit cu) {
        List<SymbolInfo> symbols = new ArrayList<>();
        for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
            symbols.add(new SymbolInfo(type.getNameAsString(), SymbolKind.TYPE,
                type.isPublic(), type.getJavadocComment().isPresent(), line(type)));
        }
        for (MethodDeclaration method : cu.findAll(MethodDeclaration.class)) {
            symbols.add(new SymbolInfo(method.getNameAsString(), SymbolKind.METHOD,
                method.isPublic(), method.getJavadocComment().isPresent(), line(method)));
        }
        for (FieldDeclaration field : cu.findAll(FieldDeclaration.class)) {
            for (VariableDeclarator variable : field.getVariables()) {
                symbols.add(new SymbolInfo(variable.getNameAsString(), SymbolKind.FIELD,
                    field.isPublic(), field.getJavadocComment().isPresent(), line(field)));
            }
        }
        return symbols;
    }

    private List<CallShape> extractCalls(CompilationUnit cu) {
        List<CallShape> calls = new ArrayList<>();
        for (MethodCallExpr call : cu.findAll(MethodCallExpr.class)) {
            List<CallArgument> arguments = new ArrayList<>();
            for (Expression argument : call.getArguments()) {
                arguments.add(toArgument(argument));
            }
            String receiver = call.getScope().map(JavaParserSourceModelProvider::simpleName).orElse("");
            calls.add(new CallShape(receiver, call.getNameAsString(), arguments));
        }
        return calls;
    }

    private List<MemberReference> extractMemberReferences(CompilationUnit cu) {
        List<MemberReference> references = new ArrayList<>();
        for (FieldAccessExpr access : cu.findAll(FieldAccessExpr.class)) {
            references.add(new MemberReference(simpleName(access.getScope()), access.getNameAsString(), false));
        }
        for (MethodCallExpr call : cu.findAll(MethodCallExpr.class)) {
            call.getScope().ifPresent(scope ->
                references.add(new MemberReference(simpleName(scope), call.getNameAsString(), true)));
        }
        return references;
    }

    private static CallArgument toArgument(Expression argument) {
        if (argument.isStringLiteralExpr()) {
            return CallArgument.literal(argument.asStringLiteralExpr().asString());
        }
        if (argument.isTextBlockLiteralExpr()) {
            return CallArgument.literal(argument.asTextBlockLiteralExpr().asString());
        }
        return CallArgument.expression(argument.toString());
    }

    private static String simpleName(Expression scope) {
        if (scope.isNameExpr()) {
            return scope.asNameExpr().getNameAsString();
        }
        if (scope.isFieldAccessExpr()) {
            return scope.asFieldAccessExpr().getNameAsString();
        }
        if (scope.isThisExpr()) {
            return "this";
        }
        return scope.toString();
    }

    private static int line(Node node) {
        return node.getBegin().map(position -> position.line).orElse(0);
    }
}
