package jevents.model;

/**
 * Thrown when a process is constructed with parameters it cannot
 * generate events from.
 */
@SuppressWarnings("serial")
public class InvalidParameterException extends IllegalArgumentException
{
	private final String parameter;
	
	public InvalidParameterException(String parameter, String message)
	{
		super(parameter + ": " + message);
		this.parameter = parameter;
	}
	
	public String getParameter()
	{
		return parameter;
	}
}
