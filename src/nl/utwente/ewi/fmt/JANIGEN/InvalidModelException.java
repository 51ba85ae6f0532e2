package nl.utwente.ewi.fmt.JANIGEN;

/** The model under construction violates a structural rule. */
public class InvalidModelException extends IllegalArgumentException
{
	private static final long serialVersionUID = 1L;

	public InvalidModelException(String msg) { super(msg); }
}
