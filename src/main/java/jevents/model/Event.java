package jevents.model;

/**
 * An arrival produced by a {@link Process}: the name of the process, the
 * time the event arrives and how long it lasts. Events are immutable;
 * start and wait times assigned by a scheduler are kept in
 * {@link EventTimings}.
 */
public final class Event
{
	private final String processName;
	private final int arrivalTime;
	private final int duration;
	
	public Event(String processName, int arrivalTime, int duration)
	{
		this.processName = processName;
		this.arrivalTime = arrivalTime;
		this.duration = duration;
	}
	
	public String getProcessName()
	{
		return processName;
	}
	
	public int getArrivalTime()
	{
		return arrivalTime;
	}
	
	public int getDuration()
	{
		return duration;
	}
	
	@Override
	public int hashCode()
	{
		int hash = processName == null ? 0 : processName.hashCode();
		hash = hash * 31 + arrivalTime;
		return hash * 31 + duration;
	}
	
	@Override
	public boolean equals(Object obj)
	{
		if(this == obj) return true;
		if(obj == null || obj.getClass() != Event.class) return false;
		
		Event event = (Event)obj;
		
		return (processName == null ? event.processName == null : processName.equals(event.processName))
		&& arrivalTime == event.arrivalTime
		&& duration == event.duration;
	}
	
	@Override
	public String toString()
	{
		return String.format("(%s, %d, %d)", processName, arrivalTime, duration);
	}
}
