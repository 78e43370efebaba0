package jevents.random.test;

import jevents.random.*;

import org.junit.*;
import static org.junit.Assert.*;

import cern.jet.random.engine.*;

public class TestExponentialSampler
{
	RandomEngine rng;
	
	@Before
	public void setUp()
	{
		rng = new MersenneTwister(2024);
	}
	
	@Test
	public void sampleMean()
	{
		ExponentialSampler sampler = new ExponentialSampler(4.0, rng);
		
		int n = 100000;
		double sum = 0;
		for(int i = 0; i < n; i++)
		{
			double x = sampler.next();
			assertTrue(x >= 0);
			sum += x;
		}
		
		assertEquals(4.0, sum / n, 0.1);
		assertEquals(4.0, sampler.getMean(), 0.0);
	}
	
	@Test
	public void memorylessTail()
	{
		// P(X > mean) = 1/e
		ExponentialSampler sampler = new ExponentialSampler(2.5, rng);
		
		int n = 100000;
		int above = 0;
		for(int i = 0; i < n; i++)
		{
			if(sampler.next() > 2.5) above++;
		}
		
		assertEquals(Math.exp(-1), above / (double)n, 0.01);
	}
	
	@Test
	public void seededSequencesMatch()
	{
		Sampler s1 = new ColtSamplerFactory(77).exponential(3.0);
		Sampler s2 = new ColtSamplerFactory(77).exponential(3.0);
		
		for(int i = 0; i < 1000; i++)
			assertEquals(s1.next(), s2.next(), 0.0);
	}
	
	@Test
	public void factorySharesEngine()
	{
		ColtSamplerFactory factory = new ColtSamplerFactory(rng);
		assertSame(rng, factory.getRandomEngine());
		
		Sampler s1 = factory.exponential(1.0);
		Sampler s2 = factory.exponential(1.0);
		assertNotEquals(s1.next(), s2.next(), 0.0);
	}
	
	@Test
	public void unseededFactoriesDiffer()
	{
		Sampler s1 = new ColtSamplerFactory().exponential(1.0);
		Sampler s2 = new ColtSamplerFactory().exponential(1.0);
		
		boolean differ = false;
		for(int i = 0; i < 10; i++)
			differ |= s1.next() != s2.next();
		assertTrue(differ);
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void zeroMean()
	{
		new ExponentialSampler(0.0, rng);
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void negativeMean()
	{
		new ExponentialSampler(-1.0, rng);
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void nanMean()
	{
		new ExponentialSampler(Double.NaN, rng);
	}
}
