package jevents.model;

import java.util.*;

import jevents.logging.*;

/**
 * Merges the events of several processes into one stream ordered by
 * arrival time and passes them to the attached loggers.
 */
public class EventStream
{
	private boolean finished = false;
	
	private List<Process> processes;
	private List<EventLogger> loggers;
	
	public EventStream(List<? extends Process> processes)
	{
		this.processes = new ArrayList<Process>(processes);
		loggers = new ArrayList<EventLogger>();
	}
	
	/**
	 * Calls {@link Process#generateEvents()} once on each process and sorts
	 * the combined events by arrival time. Ties keep process order, then
	 * the order each process emitted them in.
	 */
	public static List<Event> merge(List<? extends Process> processes)
	{
		List<Event> events = new ArrayList<Event>();
		for(Process process : processes)
			events.addAll(process.generateEvents());
		
		// List.sort is stable
		events.sort(new Comparator<Event>()
		{
			public int compare(Event e1, Event e2)
			{
				return Integer.compare(e1.getArrivalTime(), e2.getArrivalTime());
			}
		});
		return events;
	}
	
	/**
	 * Generates and merges the events and passes them to every logger. If a
	 * logger fails, every logger that was started is still ended, so output
	 * written so far is flushed and closed; failures while ending are
	 * attached to the thrown exception as suppressed.
	 */
	public List<Event> run() throws StreamException
	{
		if(finished) throw new StreamException("Already finished.");
		
		List<Event> events = merge(processes);
		List<EventLogger> started = new ArrayList<EventLogger>();
		
		try
		{
			for(EventLogger logger : loggers)
			{
				logger.logStart(processes);
				started.add(logger);
			}
			
			for(Event event : events)
			{
				for(EventLogger logger : loggers)
					logger.logEvent(event);
			}
			
			while(!started.isEmpty())
				started.remove(0).logEnd();
		}
		catch(LoggingException e)
		{
			StreamException failure = new StreamException("Logging exception thrown", e);
			for(EventLogger logger : started)
			{
				try
				{
					logger.logEnd();
				}
				catch(LoggingException endFailure)
				{
					failure.addSuppressed(endFailure);
				}
			}
			throw failure;
		}
		finally
		{
			finished = true;
		}
		
		return events;
	}
	
	public void addLogger(EventLogger logger)
	{
		loggers.add(logger);
	}
	
	public List<Process> getProcesses()
	{
		return Collections.unmodifiableList(processes);
	}
	
	public boolean isFinished()
	{
		return finished;
	}
}
