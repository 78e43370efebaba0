package jevents.model;

import java.util.*;

/**
 * Generates a fixed number of events of equal duration, starting at
 * {@code firstArrival} and spaced {@code interarrivalTime} apart.
 * Negative durations, arrivals, interarrival times and repetition counts
 * are rejected with {@link InvalidParameterException}, so arrival times
 * never decrease.
 */
public final class PeriodicProcess extends AbstractProcess
{
	private final int duration;
	private final int interarrivalTime;
	private final int firstArrival;
	private final int numRepetitions;
	
	public PeriodicProcess(String name, int duration, int interarrivalTime,
			int firstArrival, int numRepetitions)
	{
		super(name);
		this.duration = checkNonNegative("duration", duration);
		this.interarrivalTime = checkNonNegative("interarrivalTime", interarrivalTime);
		this.firstArrival = checkNonNegative("firstArrival", firstArrival);
		this.numRepetitions = checkNonNegative("numRepetitions", numRepetitions);
		
		if(numRepetitions > 0)
		{
			long lastArrival = firstArrival + (long)(numRepetitions - 1) * interarrivalTime;
			if(lastArrival > Integer.MAX_VALUE)
				throw new InvalidParameterException("numRepetitions",
						"last arrival " + lastArrival + " does not fit in an int");
		}
	}
	
	public List<Event> generateEvents()
	{
		List<Event> events = new ArrayList<Event>(numRepetitions);
		for(int i = 0; i < numRepetitions; i++)
		{
			events.add(new Event(getName(), firstArrival + i * interarrivalTime, duration));
		}
		return events;
	}
	
	public int getDuration()
	{
		return duration;
	}
	
	public int getInterarrivalTime()
	{
		return interarrivalTime;
	}
	
	public int getFirstArrival()
	{
		return firstArrival;
	}
	
	public int getNumRepetitions()
	{
		return numRepetitions;
	}
}
