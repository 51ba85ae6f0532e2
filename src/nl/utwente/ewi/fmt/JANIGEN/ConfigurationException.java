package nl.utwente.ewi.fmt.JANIGEN;

/**
 * The conversion settings or the declarations of the input cannot be
 * realised, e.g. an array literal larger than the configured maximum
 * size or a timer without a receiver.
 */
public class ConfigurationException extends IllegalArgumentException
{
	private static final long serialVersionUID = 1L;

	public ConfigurationException(String msg) { super(msg); }
	public ConfigurationException(String msg, Throwable cause) { super(msg, cause); }
}
