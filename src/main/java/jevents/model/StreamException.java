package jevents.model;

@SuppressWarnings("serial")
public class StreamException extends Exception
{
	public StreamException()
	{
		super();
	}

	public StreamException(String message, Throwable cause)
	{
		super(message, cause);
	}

	public StreamException(String message)
	{
		super(message);
	}

	public StreamException(Throwable cause)
	{
		super(cause);
	}
	
}
