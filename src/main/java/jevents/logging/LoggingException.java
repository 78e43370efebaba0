package jevents.logging;

public class LoggingException extends Exception
{
	private static final long serialVersionUID = 1L;
	
	private EventLogger logger;
	
	public LoggingException(EventLogger logger)
	{
		super();
		this.logger = logger;
	}

	public LoggingException(EventLogger logger, String message, Throwable cause)
	{
		super(message, cause);
		this.logger = logger;
	}

	public LoggingException(EventLogger logger, String message)
	{
		super(message);
		this.logger = logger;
	}

	public LoggingException(EventLogger logger, Throwable cause)
	{
		super(cause);
		this.logger = logger;
	}
	
	public EventLogger getLogger()
	{
		return logger;
	}
}
