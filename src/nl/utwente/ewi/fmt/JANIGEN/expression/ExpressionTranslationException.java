package nl.utwente.ewi.fmt.JANIGEN.expression;

/**
 * A source expression could not be translated. Carries the source
 * text so that the caller can attribute the failure to the construct
 * it came from.
 */
public class ExpressionTranslationException extends RuntimeException
{
	private static final long serialVersionUID = 1L;

	public final String source;

	public ExpressionTranslationException(String source, Throwable cause)
	{
		super("Failed to translate expression '" + source + "': " + cause.getMessage(), cause);
		this.source = source;
	}
}
