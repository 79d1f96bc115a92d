package forecasting.global;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * A frozen clock that is created once per run, so that every date defaulted during a run agrees.
 */
@Component
public class RunClock {
	private final LocalDate runDate;

	public RunClock() {
		this(Clock.systemDefaultZone());
	}

	public RunClock(final Clock clock) {
		runDate = LocalDate.now(clock);
	}

	/**
	 * Gives the date when this run started.
	 * @return the local date when the run started.
	 */
	public LocalDate today() {
		return runDate;
	}
}
