package ai.convoy.scheduler.events;

import ai.convoy.scheduler.SchedulerHarness;
import ai.convoy.scheduler.lifecycle.LeaseState;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

public class LeaseEventJournalTest {
    private SchedulerHarness h;

    @Before
    public void setUp() {
        h = new SchedulerHarness();
        h.accountant().updateCapacity(SchedulerHarness.cpu("10"));
    }

    @After
    public void tearDown() {
        h.close();
    }

    @Test
    public void testEventsGroupedByJobSet() throws Exception {
        var mapper = new JobSetIdMapper(new InMemoryJobSetIdSource(h.clock), 10);
        var journal = new LeaseEventJournal(mapper, h.clock, 3);

        var first = h.issue(h.submit("j1", "q1", "1"), "s1");
        var second = h.issue(h.submit("j2", "q1", "1"), "s1");
        journal.record(first, LeaseState.ISSUED);
        journal.record(second, LeaseState.ISSUED);
        journal.record(first, LeaseState.DONE);
        journal.record(second, LeaseState.EXPIRED);

        long handle = mapper.get("q1", "set-1");
        var events = journal.eventsOf(handle);
        Assert.assertEquals(3, events.size());
        Assert.assertEquals(List.of(LeaseState.ISSUED, LeaseState.DONE, LeaseState.EXPIRED),
            events.stream().map(LeaseEvent::state).toList());
        Assert.assertEquals(List.of(LeaseState.DONE),
            journal.eventsOfJob("j1").stream().map(LeaseEvent::state).toList());
        Assert.assertTrue(journal.eventsOf(handle + 1).isEmpty());
    }
}
