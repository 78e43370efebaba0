package jevents.model;

/**
 * Start and wait times assigned to one event by a scheduler. Both are
 * zero until set.
 */
public class EventTiming
{
	private int startTime;
	private int waitTime;
	
	public int getStartTime()
	{
		return startTime;
	}
	
	public void setStartTime(int startTime)
	{
		this.startTime = startTime;
	}
	
	public int getWaitTime()
	{
		return waitTime;
	}
	
	public void setWaitTime(int waitTime)
	{
		this.waitTime = waitTime;
	}
	
	@Override
	public String toString()
	{
		return String.format("(start=%d, wait=%d)", startTime, waitTime);
	}
}
