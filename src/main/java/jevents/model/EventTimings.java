package jevents.model;

import java.util.*;

/**
 * Timing slots for events, owned by whatever schedules them. Slots are
 * keyed by event identity: equal events produced by different calls to
 * {@link Process#generateEvents()} get separate slots.
 */
public class EventTimings
{
	private Map<Event, EventTiming> timings;
	
	public EventTimings()
	{
		timings = new IdentityHashMap<Event, EventTiming>();
	}
	
	/**
	 * Returns the timing slot for an event, creating a zeroed one on
	 * first access.
	 */
	public EventTiming get(Event event)
	{
		if(event == null)
			throw new NullPointerException("event");
		
		EventTiming timing = timings.get(event);
		if(timing == null)
		{
			timing = new EventTiming();
			timings.put(event, timing);
		}
		return timing;
	}
	
	public boolean contains(Event event)
	{
		return timings.containsKey(event);
	}
	
	public void remove(Event event)
	{
		timings.remove(event);
	}
	
	public int size()
	{
		return timings.size();
	}
}
