package jevents.model;

import java.util.*;

/**
 * Generates exactly one event.
 */
public final class SingletonProcess extends AbstractProcess
{
	private final int duration;
	private final int arrival;
	
	public SingletonProcess(String name, int duration, int arrival)
	{
		super(name);
		this.duration = checkNonNegative("duration", duration);
		this.arrival = checkNonNegative("arrival", arrival);
	}
	
	public List<Event> generateEvents()
	{
		List<Event> events = new ArrayList<Event>(1);
		events.add(new Event(getName(), arrival, duration));
		return events;
	}
	
	public int getDuration()
	{
		return duration;
	}
	
	public int getArrival()
	{
		return arrival;
	}
}
