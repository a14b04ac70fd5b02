package org.surn.compiler.util;

import org.surn.compiler.frontend.parser.ast.ArrayExpression;
import org.surn.compiler.frontend.parser.ast.AstBody;
import org.surn.compiler.frontend.parser.ast.AstNode;
import org.surn.compiler.frontend.parser.ast.BlockStatement;
import org.surn.compiler.frontend.parser.ast.CallExpression;
import org.surn.compiler.frontend.parser.ast.ClassDeclaration;
import org.surn.compiler.frontend.parser.ast.ClassMember;
import org.surn.compiler.frontend.parser.ast.ClassProperty;
import org.surn.compiler.frontend.parser.ast.ClassStatement;
import org.surn.compiler.frontend.parser.ast.ConstStatement;
import org.surn.compiler.frontend.parser.ast.EndOfLineExpression;
import org.surn.compiler.frontend.parser.ast.Function;
import org.surn.compiler.frontend.parser.ast.FunctionStatement;
import org.surn.compiler.frontend.parser.ast.ImportStatement;
import org.surn.compiler.frontend.parser.ast.LiteralExpression;
import org.surn.compiler.frontend.parser.ast.LiteralKind;
import org.surn.compiler.frontend.parser.ast.MacroInvocationStatement;
import org.surn.compiler.frontend.parser.ast.MemberExpression;
import org.surn.compiler.frontend.parser.ast.MemberLookup;
import org.surn.compiler.frontend.parser.ast.MethodCallExpression;
import org.surn.compiler.frontend.parser.ast.NamespaceStatement;
import org.surn.compiler.frontend.parser.ast.NewExpression;
import org.surn.compiler.frontend.parser.ast.Node;
import org.surn.compiler.frontend.parser.ast.ObjectExpression;
import org.surn.compiler.frontend.parser.ast.OperationExpression;
import org.surn.compiler.frontend.parser.ast.ReturnStatement;
import org.surn.compiler.frontend.parser.ast.StatementExpression;
import org.surn.compiler.frontend.parser.ast.StaticStatement;
import org.surn.compiler.frontend.parser.ast.TypeDefStatement;
import org.surn.compiler.frontend.parser.ast.VarStatement;
import org.surn.compiler.frontend.parser.ast.Variable;
import org.surn.compiler.frontend.parser.ast.Visibility;
import org.surn.compiler.frontend.parser.types.TypeDefinition;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders parsed trees as S-expressions, one top-level node per line, e.g.
 * {@code (var x: int 5)} or {@code (+ 1 (* 2 3))}. Used for debug dumps and the CLI.
 */
public final class AstPrinter {

	private AstPrinter() {}

	/**
	 * @param body A parsed file.
	 * @return Every top-level node on its own line.
	 */
	public static String print(AstBody body) {
		return body.getProgram().stream()
				.map(Node::inner)
				.map(AstPrinter::print)
				.collect(Collectors.joining("\n"));
	}

	/**
	 * @param node Any expression or statement.
	 * @return The S-expression of the node.
	 */
	public static String print(AstNode node) {
		if (node == null) return "()";

		// Expressions
		if (node instanceof LiteralExpression l) {
			return l.kind() == LiteralKind.STRING ? "\"" + l.value() + "\"" : l.value();
		}
		if (node instanceof OperationExpression o) {
			return "(" + o.operator().symbol() + " " + print(o.left()) + " " + print(o.right()) + ")";
		}
		if (node instanceof CallExpression c) {
			return "(call " + c.name() + args(c.arguments()) + ")";
		}
		if (node instanceof MethodCallExpression m) {
			return "(method-call " + print(m.callee()) + " " + m.name() + args(m.arguments()) + ")";
		}
		if (node instanceof NewExpression n) {
			return "(new " + n.name() + args(n.arguments()) + ")";
		}
		if (node instanceof ArrayExpression a) {
			return "(array" + args(a.values()) + ")";
		}
		if (node instanceof ObjectExpression o) {
			return "(object" + o.properties().stream()
					.map(p -> " (" + p.name() + " " + print(p.value()) + ")")
					.collect(Collectors.joining()) + ")";
		}
		if (node instanceof MemberExpression m) {
			return "(member " + m.origin() + " " + lookup(m.lookup()) + " " + print(m.member()) + ")";
		}
		if (node instanceof StatementExpression s) {
			return print(s.statement());
		}
		if (node instanceof EndOfLineExpression) {
			return "(eol)";
		}

		// Statements
		if (node instanceof VarStatement v) {
			return variable("var", v.variable());
		}
		if (node instanceof ConstStatement c) {
			return variable("const", c.variable());
		}
		if (node instanceof StaticStatement s) {
			return "(static " + visibility(s.visibility()) + print(s.statement()) + ")";
		}
		if (node instanceof FunctionStatement f) {
			return function(f.function());
		}
		if (node instanceof ClassStatement c) {
			return classDeclaration(c.declaration());
		}
		if (node instanceof BlockStatement b) {
			return "(block" + args(b.body()) + ")";
		}
		if (node instanceof ImportStatement i) {
			return "(use " + i.path() + ")";
		}
		if (node instanceof NamespaceStatement n) {
			String body = n.namespace().body() == null ? "" : " " + print(n.namespace().body());
			return "(namespace " + n.namespace().path() + body + ")";
		}
		if (node instanceof TypeDefStatement t) {
			TypeDefinition definition = t.definition();
			String params = definition.params().isEmpty() ? ""
					: definition.params().stream().map(Object::toString).collect(Collectors.joining(", ", "<", ">"));
			return "(type " + definition.name() + params + " " + definition.kind() + ")";
		}
		if (node instanceof ReturnStatement r) {
			return r.expression() == null ? "(return)" : "(return " + print(r.expression()) + ")";
		}
		if (node instanceof MacroInvocationStatement m) {
			return "(macro " + m.macro().name() + ")";
		}
		throw new IllegalArgumentException("Unsupported node: " + node.getClass().getSimpleName());
	}

	private static String args(List<? extends AstNode> nodes) {
		return nodes.stream().map(n -> " " + print(n)).collect(Collectors.joining());
	}

	private static String variable(String keyword, Variable variable) {
		StringBuilder sb = new StringBuilder("(").append(keyword).append(' ');
		if (variable.visibility() != Visibility.PRIVATE) sb.append(visibility(variable.visibility()));
		sb.append(variable.name());
		if (variable.type() != null) sb.append(": ").append(variable.type());
		if (variable.assignment() != null) sb.append(' ').append(print(variable.assignment()));
		return sb.append(')').toString();
	}

	private static String function(Function function) {
		StringBuilder sb = new StringBuilder("(function ");
		sb.append(visibility(function.visibility()));
		sb.append(function.isAnonymous() ? "<anonymous>" : function.name());
		sb.append(function.inputs().stream()
				.map(i -> i.name() + ": " + i.type())
				.collect(Collectors.joining(", ", " (", ")")));
		if (function.returnType() != null) sb.append(": ").append(function.returnType());
		sb.append(' ').append(print(function.body()));
		return sb.append(')').toString();
	}

	private static String classDeclaration(ClassDeclaration declaration) {
		StringBuilder sb = new StringBuilder("(class ").append(declaration.name());
		if (declaration.superclass() != null) sb.append(" extends ").append(declaration.superclass());
		if (declaration.interfaces() != null) sb.append(" implements ").append(String.join(", ", declaration.interfaces()));
		for (ClassProperty property : declaration.body().properties()) {
			sb.append(' ').append(property(property));
		}
		for (Function method : declaration.body().methods()) {
			sb.append(' ').append(function(method));
		}
		for (ClassMember member : declaration.body().other()) {
			sb.append(' ').append(member(member));
		}
		return sb.append(')').toString();
	}

	private static String property(ClassProperty property) {
		StringBuilder sb = new StringBuilder("(property ").append(visibility(property.visibility())).append(property.name());
		if (property.type() != null) sb.append(": ").append(property.type());
		if (property.assignment() != null) sb.append(' ').append(print(property.assignment()));
		return sb.append(')').toString();
	}

	private static String member(ClassMember member) {
		if (member instanceof ClassMember.Property p) return property(p.property());
		if (member instanceof ClassMember.Method m) return function(m.method());
		if (member instanceof ClassMember.Import i) return "(use " + i.path() + ")";
		if (member instanceof ClassMember.Macro m) return "(macro " + m.macro().name() + ")";
		ClassMember.Static s = (ClassMember.Static) member;
		return "(static " + visibility(s.visibility()) + member(s.member()) + ")";
	}

	private static String lookup(MemberLookup lookup) {
		switch (lookup) {
			case STATIC: return "::";
			case INDEX: return "[]";
			default: return ".";
		}
	}

	private static String visibility(Visibility visibility) {
		return visibility.name().toLowerCase() + " ";
	}
}
