package nl.utwente.ewi.fmt.JANIGEN.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.mozilla.javascript.CompilerEnvirons;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.EvaluatorException;
import org.mozilla.javascript.Node;
import org.mozilla.javascript.Parser;
import org.mozilla.javascript.Token;
import org.mozilla.javascript.ast.ArrayLiteral;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.AstRoot;
import org.mozilla.javascript.ast.ElementGet;
import org.mozilla.javascript.ast.ExpressionStatement;
import org.mozilla.javascript.ast.FunctionCall;
import org.mozilla.javascript.ast.InfixExpression;
import org.mozilla.javascript.ast.KeywordLiteral;
import org.mozilla.javascript.ast.Name;
import org.mozilla.javascript.ast.NewExpression;
import org.mozilla.javascript.ast.NumberLiteral;
import org.mozilla.javascript.ast.ParenthesizedExpression;
import org.mozilla.javascript.ast.PropertyGet;
import org.mozilla.javascript.ast.UnaryExpression;

import nl.utwente.ewi.fmt.JANIGEN.ConfigurationException;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniBaseType;

/**
 * Translates ECMAScript expressions, as written in state-machine
 * conditions and assignments, into {@link Expression}s.
 */
public class ExpressionTranslator
{
	private static final Map<Integer, Operator> BINARY_OPERATORS = Map.ofEntries(
			Map.entry(Token.ADD, Operator.ADD),
			Map.entry(Token.SUB, Operator.SUBTRACT),
			Map.entry(Token.MUL, Operator.MULTIPLY),
			Map.entry(Token.DIV, Operator.DIVIDE),
			Map.entry(Token.MOD, Operator.MODULO),
			Map.entry(Token.LT, Operator.LESS),
			Map.entry(Token.LE, Operator.LESS_OR_EQUAL),
			Map.entry(Token.GT, Operator.GREATER),
			Map.entry(Token.GE, Operator.GREATER_OR_EQUAL),
			Map.entry(Token.EQ, Operator.EQUALS),
			Map.entry(Token.NE, Operator.NOT_EQUALS),
			Map.entry(Token.AND, Operator.AND),
			Map.entry(Token.OR, Operator.OR));

	private static final Map<String, Operator> MATH_FUNCTIONS = Map.of(
			"abs", Operator.ABS,
			"floor", Operator.FLOOR,
			"ceil", Operator.CEIL,
			"cos", Operator.COS,
			"sin", Operator.SIN,
			"log", Operator.LOG,
			"pow", Operator.POW,
			"min", Operator.MIN,
			"max", Operator.MAX);
	private static final String RANDOM_FUNCTION = "random";

	/* Shapes of the array variables in scope, for literals compared
	 * with them. */
	private final Map<String, ArrayInfo> arrays;

	private ExpressionTranslator(Map<String, ArrayInfo> arrays) {
		this.arrays = arrays;
	}

	public static Expression translate(String source) {
		return translate(source, null, Map.of());
	}

	public static Expression translate(String source, ArrayInfo arrayShape) {
		return translate(source, arrayShape, Map.of());
	}

	/**
	 * Translate a single source expression.
	 *
	 * @param source The ECMAScript expression.
	 * @param arrayShape Shape of the value, required when the
	 * expression is an array literal; null otherwise.
	 * @param arrays Shapes of the array variables that array literals
	 * may be compared with.
	 * @throws ExpressionTranslationException for every syntax error
	 * or unsupported construct.
	 */
	public static Expression translate(String source, ArrayInfo arrayShape,
	                                   Map<String, ArrayInfo> arrays)
	{
		if (source == null)
			throw new IllegalArgumentException("No expression to translate");
		try {
			return new ExpressionTranslator(arrays).translateNode(parseSingleExpression(source), arrayShape);
		} catch (EvaluatorException | IllegalArgumentException | UnsupportedOperationException e) {
			throw new ExpressionTranslationException(source, e);
		}
	}

	/**
	 * The number of elements of an array literal, before padding.
	 *
	 * @return The number of elements, or -1 if the source is not an
	 * array literal.
	 */
	public static int arrayLiteralLength(String source) {
		try {
			AstNode node = parseSingleExpression(source);
			while (node instanceof ParenthesizedExpression)
				node = ((ParenthesizedExpression)node).getExpression();
			if (!(node instanceof ArrayLiteral))
				return -1;
			return ((ArrayLiteral)node).getElements().size();
		} catch (EvaluatorException | IllegalArgumentException | UnsupportedOperationException e) {
			throw new ExpressionTranslationException(source, e);
		}
	}

	private static AstNode parseSingleExpression(String source) {
		CompilerEnvirons env = new CompilerEnvirons();
		env.setLanguageVersion(Context.VERSION_1_8);
		env.setRecordingComments(false);
		AstRoot root = new Parser(env).parse(source, "<expression>", 1);
		ArrayList<AstNode> statements = new ArrayList<>();
		for (Node n : root)
			statements.add((AstNode)n);
		if (statements.size() != 1)
			throw new IllegalArgumentException("Expected exactly one expression, found " + statements.size() + " statements");
		AstNode statement = statements.get(0);
		if (!(statement instanceof ExpressionStatement))
			throw new UnsupportedOperationException("Expected an expression, found: " + statement.getClass().getSimpleName());
		return ((ExpressionStatement)statement).getExpression();
	}

	private Expression translateNode(AstNode node, ArrayInfo arrayShape) {
		if (node instanceof ParenthesizedExpression)
			return translateNode(((ParenthesizedExpression)node).getExpression(), arrayShape);
		if (node instanceof NumberLiteral)
			return translateNumber((NumberLiteral)node);
		if (node instanceof KeywordLiteral) {
			int type = node.getType();
			if (type == Token.TRUE)
				return ConstantExpression.TRUE;
			if (type == Token.FALSE)
				return ConstantExpression.FALSE;
			throw new UnsupportedOperationException("Unsupported keyword: " + node.toSource());
		}
		if (node instanceof Name)
			return translateName(((Name)node).getIdentifier());
		if (node instanceof PropertyGet)
			return translateMember((PropertyGet)node);
		if (node instanceof ElementGet) {
			ElementGet get = (ElementGet)node;
			return OperatorExpression.arrayAccess(
					translateNode(get.getTarget(), null),
					translateNode(get.getElement(), null));
		}
		if (node instanceof UnaryExpression)
			return translateUnary((UnaryExpression)node);
		if (node instanceof NewExpression)
			throw new UnsupportedOperationException("Object creation is not supported: " + node.toSource());
		if (node instanceof FunctionCall)
			return translateCall((FunctionCall)node);
		if (node instanceof ArrayLiteral)
			return translateArray((ArrayLiteral)node, arrayShape, true);
		if (node instanceof InfixExpression)
			return translateInfix((InfixExpression)node);
		throw new UnsupportedOperationException("Unsupported construct " + node.getClass().getSimpleName() + ": " + node.toSource());
	}

	/* Values written as 1.0 stay real even though they are integral. */
	private ConstantExpression translateNumber(NumberLiteral literal) {
		String raw = literal.getValue();
		double value = literal.getNumber();
		int dot = raw.indexOf('.');
		boolean writtenAsReal = dot >= 0 && dot == raw.lastIndexOf('.');
		if (!writtenAsReal && value == Math.rint(value) && Math.abs(value) <= Long.MAX_VALUE)
			return new ConstantExpression((long)value);
		return new ConstantExpression(value);
	}

	private Expression translateName(String id) {
		if ("True".equals(id) || "False".equals(id))
			throw new IllegalArgumentException("'" + id + "' is not a boolean literal, use '" + id.toLowerCase() + "' instead");
		return new VariableExpression(id);
	}

	private String dottedName(AstNode node) {
		if (node instanceof Name)
			return ((Name)node).getIdentifier();
		if (node instanceof PropertyGet) {
			PropertyGet get = (PropertyGet)node;
			return dottedName(get.getTarget()) + "." + get.getProperty().getIdentifier();
		}
		throw new UnsupportedOperationException("Only identifiers can be accessed with '.', not: " + node.toSource());
	}

	private Expression translateMember(PropertyGet get) {
		String name = dottedName(get);
		if ("Math.PI".equals(name))
			return ConstantExpression.PI;
		if ("Math.E".equals(name))
			return ConstantExpression.E;
		return translateName(name);
	}

	private Expression translateUnary(UnaryExpression unary) {
		Expression operand = translateNode(unary.getOperand(), null);
		switch (unary.getOperator()) {
		case Token.NEG:
			return OperatorExpression.binary(Operator.SUBTRACT, new ConstantExpression(0L), operand);
		case Token.NOT:
			return OperatorExpression.unary(Operator.NOT, operand);
		default:
			throw new IllegalArgumentException("Unsupported unary operator: " + unary.toSource());
		}
	}

	private Expression translateInfix(InfixExpression infix) {
		Operator op = BINARY_OPERATORS.get(infix.getOperator());
		if (op == null)
			throw new IllegalArgumentException("Unsupported operator in: " + infix.toSource());
		AstNode left = infix.getLeft(), right = infix.getRight();
		ArrayInfo leftShape = null, rightShape = null;
		if (op == Operator.EQUALS || op == Operator.NOT_EQUALS) {
			if (right instanceof ArrayLiteral)
				rightShape = arrayShapeOf(left);
			if (left instanceof ArrayLiteral)
				leftShape = arrayShapeOf(right);
		}
		return OperatorExpression.binary(op,
				translateOperand(left, leftShape),
				translateOperand(right, rightShape));
	}

	/* Array literals in comparisons keep their length. */
	private Expression translateOperand(AstNode node, ArrayInfo comparedShape) {
		if (comparedShape != null)
			return translateArray((ArrayLiteral)node, comparedShape, false);
		return translateNode(node, null);
	}

	private ArrayInfo arrayShapeOf(AstNode node) {
		if (!(node instanceof Name) && !(node instanceof PropertyGet))
			return null;
		return arrays.get(dottedName(node));
	}

	private Expression translateCall(FunctionCall call) {
		AstNode target = call.getTarget();
		String callee = (target instanceof Name || target instanceof PropertyGet) ? dottedName(target) : null;
		if (callee == null || !callee.startsWith("Math."))
			throw new UnsupportedOperationException("Only Math functions can be called, not: " + target.toSource());
		String function = callee.substring("Math.".length());
		List<AstNode> args = call.getArguments();
		if (RANDOM_FUNCTION.equals(function)) {
			checkArgCount(callee, args, 0);
			return DistributionExpression.uniform(0.0, 1.0);
		}
		Operator op = MATH_FUNCTIONS.get(function);
		if (op == null)
			throw new UnsupportedOperationException("Unknown function: " + callee);
		if (op == Operator.LOG) {
			checkArgCount(callee, args, 1);
			return OperatorExpression.binary(op, translateNode(args.get(0), null), ConstantExpression.E);
		}
		if (op.operands.size() == 1) {
			checkArgCount(callee, args, 1);
			return OperatorExpression.unary(op, translateNode(args.get(0), null));
		}
		checkArgCount(callee, args, 2);
		return OperatorExpression.binary(op,
				translateNode(args.get(0), null),
				translateNode(args.get(1), null));
	}

	private void checkArgCount(String callee, List<AstNode> args, int expected) {
		if (args.size() != expected)
			throw new IllegalArgumentException(callee + " takes " + expected + " argument(s), not " + args.size());
	}

	private Expression translateArray(ArrayLiteral literal, ArrayInfo shape, boolean pad) {
		if (shape == null)
			throw new IllegalArgumentException("Array literal without a known array type: " + literal.toSource());
		List<AstNode> elements = literal.getElements();
		if (elements.isEmpty() && pad)
			return shape.createEmpty();
		if (elements.size() > shape.getMaxSize())
			throw new ConfigurationException("Array literal has " + elements.size() + " elements, but the maximum size is " + shape.getMaxSize());
		ArrayList<Expression> values = new ArrayList<>(shape.getMaxSize());
		for (AstNode element : elements) {
			if (shape.getDimensions() > 1) {
				if (!(element instanceof ArrayLiteral))
					throw new IllegalArgumentException("Expected a nested array, found: " + element.toSource());
				values.add(translateArray((ArrayLiteral)element, shape.elementShape(), pad));
			} else {
				values.add(translateArrayElement(element, shape.elementType));
			}
		}
		while (pad && values.size() < shape.getMaxSize()) {
			if (shape.getDimensions() > 1)
				values.add(shape.elementShape().createEmpty());
			else
				values.add(ConstantExpression.zeroOf(shape.elementType));
		}
		return new ArrayValueExpression(values);
	}

	private Expression translateArrayElement(AstNode element, JaniBaseType type) {
		AstNode literal = element;
		boolean negate = false;
		if (literal instanceof UnaryExpression && ((UnaryExpression)literal).getOperator() == Token.NEG) {
			negate = true;
			literal = ((UnaryExpression)literal).getOperand();
		}
		Expression e = translateNode(literal, null);
		if (!(e instanceof ConstantExpression) || ((ConstantExpression)e).symbol != null)
			throw new IllegalArgumentException("Array elements should be literals, not: " + element.toSource());
		Object v = ((ConstantExpression)e).value;
		switch (type) {
		case BOOLEAN:
			if (!(v instanceof Boolean) || negate)
				break;
			return e;
		case INTEGER:
			if (!(v instanceof Long))
				break;
			return negate ? new ConstantExpression(-((Long)v).longValue()) : e;
		case REAL:
			if (!(v instanceof Number))
				break;
			double d = ((Number)v).doubleValue();
			return new ConstantExpression(negate ? -d : d);
		}
		throw new IllegalArgumentException("Array element " + element.toSource() + " is not of type " + type.janiName);
	}
}
