package jevents.model.test;

import java.util.*;

import jevents.model.*;

import org.junit.*;
import static org.junit.Assert.*;

public class TestPeriodicProcess
{
	@Test
	public void threeRepetitions()
	{
		List<Event> events = new PeriodicProcess("B", 2, 10, 0, 3).generateEvents();
		
		List<Event> expected = Arrays.asList(
				new Event("B", 0, 2),
				new Event("B", 10, 2),
				new Event("B", 20, 2));
		assertEquals(expected, events);
	}
	
	@Test
	public void countMatchesRepetitions()
	{
		for(int n = 0; n <= 50; n++)
		{
			assertEquals(n, new PeriodicProcess("B", 1, 3, 7, n).generateEvents().size());
		}
	}
	
	@Test
	public void noRepetitions()
	{
		assertTrue(new PeriodicProcess("B", 2, 10, 0, 0).generateEvents().isEmpty());
	}
	
	@Test
	public void spacingAndDuration()
	{
		int firstArrival = 13;
		int interarrivalTime = 7;
		int duration = 4;
		List<Event> events = new PeriodicProcess("P", duration, interarrivalTime, firstArrival, 25).generateEvents();
		
		for(int i = 0; i < events.size(); i++)
		{
			assertEquals(firstArrival + i * interarrivalTime, events.get(i).getArrivalTime());
			assertEquals(duration, events.get(i).getDuration());
			assertEquals("P", events.get(i).getProcessName());
		}
	}
	
	@Test
	public void zeroInterarrivalTime()
	{
		List<Event> events = new PeriodicProcess("P", 1, 0, 5, 3).generateEvents();
		
		assertEquals(3, events.size());
		for(Event event : events)
			assertEquals(5, event.getArrivalTime());
	}
	
	@Test
	public void idempotent()
	{
		PeriodicProcess process = new PeriodicProcess("B", 2, 10, 0, 5);
		
		List<Event> first = process.generateEvents();
		List<Event> second = process.generateEvents();
		
		assertEquals(first, second);
		assertNotSame(first, second);
		
		second.remove(0);
		assertEquals(5, first.size());
		assertEquals(5, process.generateEvents().size());
	}
	
	@Test
	public void lastArrivalAtIntLimit()
	{
		PeriodicProcess process = new PeriodicProcess("B", 1, 1, Integer.MAX_VALUE - 2, 3);
		List<Event> events = process.generateEvents();
		assertEquals(Integer.MAX_VALUE, events.get(2).getArrivalTime());
	}
	
	@Test
	public void overflowingSchedule()
	{
		try
		{
			new PeriodicProcess("B", 1, Integer.MAX_VALUE, 1, 2);
			fail("Expected InvalidParameterException");
		}
		catch(InvalidParameterException e)
		{
			assertEquals("numRepetitions", e.getParameter());
		}
	}
	
	@Test
	public void negativeRepetitions()
	{
		try
		{
			new PeriodicProcess("B", 1, 1, 0, -1);
			fail("Expected InvalidParameterException");
		}
		catch(InvalidParameterException e)
		{
			assertEquals("numRepetitions", e.getParameter());
		}
	}
	
	@Test(expected = InvalidParameterException.class)
	public void negativeDuration()
	{
		new PeriodicProcess("B", -2, 10, 0, 3);
	}
	
	@Test(expected = InvalidParameterException.class)
	public void negativeInterarrivalTime()
	{
		new PeriodicProcess("B", 2, -10, 0, 3);
	}
	
	@Test(expected = InvalidParameterException.class)
	public void negativeFirstArrival()
	{
		new PeriodicProcess("B", 2, 10, -1, 3);
	}
}
