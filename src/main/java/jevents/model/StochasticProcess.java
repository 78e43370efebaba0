package jevents.model;

import java.util.*;

import cern.jet.random.engine.RandomEngine;

import jevents.random.*;

/**
 * Renewal process with exponentially distributed durations and
 * interarrival times. Events are generated from {@code firstArrival} until
 * an arrival reaches {@code endTime}; the horizon bounds arrivals, so the
 * last event may run past it.
 * 
 * Both samplers are created from the process's {@link SamplerFactory} on
 * every call to {@link #generateEvents()}. With a {@link ColtSamplerFactory}
 * they draw from the factory's engine, which is not reset between calls:
 * repeated calls continue the random stream, while two processes built
 * from identically seeded engines generate identical events.
 * 
 * There is no cap on the number of events. Small means produce long lists.
 */
public final class StochasticProcess extends AbstractProcess
{
	private final double meanDuration;
	private final double meanInterarrivalTime;
	private final int firstArrival;
	private final int endTime;
	
	private final SamplerFactory samplers;
	
	public StochasticProcess(String name, double meanDuration, double meanInterarrivalTime,
			int firstArrival, int endTime, SamplerFactory samplers)
	{
		super(name);
		this.meanDuration = checkMean("meanDuration", meanDuration);
		this.meanInterarrivalTime = checkMean("meanInterarrivalTime", meanInterarrivalTime);
		this.firstArrival = checkNonNegative("firstArrival", firstArrival);
		this.endTime = endTime;
		
		if(samplers == null)
			throw new InvalidParameterException("samplers", "must not be null");
		this.samplers = samplers;
	}
	
	public StochasticProcess(String name, double meanDuration, double meanInterarrivalTime,
			int firstArrival, int endTime, RandomEngine rng)
	{
		this(name, meanDuration, meanInterarrivalTime, firstArrival, endTime,
				new ColtSamplerFactory(rng));
	}
	
	public StochasticProcess(String name, double meanDuration, double meanInterarrivalTime,
			int firstArrival, int endTime)
	{
		this(name, meanDuration, meanInterarrivalTime, firstArrival, endTime,
				new ColtSamplerFactory());
	}
	
	public List<Event> generateEvents()
	{
		List<Event> events = new ArrayList<Event>();
		
		Sampler durationDist = samplers.exponential(meanDuration);
		Sampler interarrivalDist = samplers.exponential(meanInterarrivalTime);
		
		long arrivalTime = firstArrival;
		while(arrivalTime < endTime)
		{
			int duration = (int)durationDist.next();
			events.add(new Event(getName(), (int)arrivalTime, duration));
			
			long gap = (long)interarrivalDist.next();
			if(gap >= endTime - arrivalTime)
				break;
			arrivalTime += gap;
		}
		
		return events;
	}
	
	public double getMeanDuration()
	{
		return meanDuration;
	}
	
	public double getMeanInterarrivalTime()
	{
		return meanInterarrivalTime;
	}
	
	public int getFirstArrival()
	{
		return firstArrival;
	}
	
	public int getEndTime()
	{
		return endTime;
	}
}
