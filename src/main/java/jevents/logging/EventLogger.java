package jevents.logging;

import java.util.List;

import jevents.model.*;
import jevents.model.Process;

public interface EventLogger
{
	public void logStart(List<? extends Process> processes) throws LoggingException;
	public void logEnd() throws LoggingException;
	
	public void logEvent(Event event) throws LoggingException;
}
