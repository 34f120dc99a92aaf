package org.janelia.coreprep.common;

import java.util.concurrent.TimeUnit;

import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

public class TimedCondTest {

    private FakeTicker ticker;
    private DatedObject<String> datedState;

    @Before
    public void setUp() {
        ticker = new FakeTicker();
        datedState = new DatedObject<>("state", ticker);
    }

    @Test
    public void unsatisfiedConditionBeforeTimeout() {
        ticker.advance(5, TimeUnit.SECONDS);
        TimedCond<String> cond = new TimedCond<>(datedState, false, 10000);
        assertThat(cond.isCondValue(), equalTo(false));
        assertThat(cond.isNotCondValue(), equalTo(true));
    }

    @Test(expected = CondTimeoutException.class)
    public void unsatisfiedConditionAfterTimeout() {
        ticker.advance(11, TimeUnit.SECONDS);
        new TimedCond<>(datedState, false, 10000).isCondValue();
    }

    @Test
    public void satisfiedConditionNeverTimesOut() {
        ticker.advance(1, TimeUnit.HOURS);
        TimedCond<String> cond = new TimedCond<>(datedState, true, 10000);
        assertThat(cond.isCondValue(), equalTo(true));
        assertThat(cond.getState().getObj(), equalTo("state"));
    }

    @Test
    public void noTimeoutIfNotPositive() {
        ticker.advance(1, TimeUnit.DAYS);
        assertThat(new TimedCond<>(datedState, false, 0).isCondValue(), equalTo(false));
    }
}
