package com.bit.vote.event;

import com.bit.vote.database.DataBase;
import com.bit.vote.database.memory.MemoryDb;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EventServiceImplTest {

    private DataBase dataBase;
    private EventService events;
    private final List<Object> published = new ArrayList<>();

    @BeforeEach
    void setUp() {
        dataBase = new MemoryDb();
        events = new EventServiceImpl(dataBase, new ObjectMapper(), published::add);
    }

    @Test
    void stagedEventsAreNumberedAndDecoded() {
        dataBase.dataTransaction(events.stage(new ProjectCreatedEvent(0, "p", 10, 20, 5)));
        dataBase.dataTransaction(events.stage(new VoteCastEvent(0, "voter", 7, 11)));
        assertEquals(2, events.count());

        List<VotingEvent> list = events.list(1, 10);
        assertEquals(2, list.size());
        ProjectCreatedEvent created = (ProjectCreatedEvent) list.get(0);
        assertEquals(1, created.getSequence());
        assertEquals("p", created.getName());
        VoteCastEvent cast = (VoteCastEvent) list.get(1);
        assertEquals(2, cast.getSequence());
        assertEquals(7, cast.getAmount());

        assertEquals(1, events.list(2, 10).size());
        assertEquals(1, events.list(1, 1).size());
    }

    @Test
    void uncommittedStageLeavesLogUntouched() {
        dataBase.dataTransaction(events.stage(new VoteCastEvent(0, "a", 1, 1)));
        // 只生成写操作 未提交
        events.stage(new TokensUnstakedEvent(0, "a", 1, false, 2));
        assertEquals(1, events.count());
        assertEquals(1, events.list(1, 10).size());

        TokensUnstakedEvent next = new TokensUnstakedEvent(0, "b", 3, false, 3);
        dataBase.dataTransaction(events.stage(next));
        assertEquals(2, next.getSequence());
        assertEquals(2, events.count());
    }

    @Test
    void publishForwardsToListeners() {
        VoteCastEvent event = new VoteCastEvent(0, "a", 1, 1);
        events.publish(event);
        assertEquals(List.of(event), published);
        assertTrue(events.list(1, 10).isEmpty());
    }
}
