package jevents.model;

import java.util.List;

/**
 * A named generator of events. Implemented by {@link SingletonProcess},
 * {@link PeriodicProcess} and {@link StochasticProcess}.
 * 
 * Every call to {@link #generateEvents()} returns a new, finite list whose
 * events all carry this process's name. Lists returned by earlier calls are
 * never modified.
 */
public interface Process
{
	public String getName();
	public List<Event> generateEvents();
}
