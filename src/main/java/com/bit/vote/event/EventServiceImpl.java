package com.bit.vote.event;

import com.bit.vote.database.DataBase;
import com.bit.vote.database.DbOperation;
import com.bit.vote.database.TableEnum;
import com.bit.vote.util.ByteUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class EventServiceImpl implements EventService {

    static final byte[] EVENT_SEQ_KEY = "event_seq".getBytes(StandardCharsets.UTF_8);

    private final DataBase dataBase;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher publisher;

    public EventServiceImpl(DataBase dataBase, ObjectMapper objectMapper, ApplicationEventPublisher publisher) {
        this.dataBase = dataBase;
        this.objectMapper = objectMapper;
        this.publisher = publisher;
    }

    @Override
    public synchronized List<DbOperation> stage(VotingEvent event) {
        long sequence = count() + 1;
        event.setSequence(sequence);
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("事件序列化失败: " + event, e);
        }
        List<DbOperation> ops = new ArrayList<>(2);
        ops.add(DbOperation.put(TableEnum.EVENT, ByteUtils.longToBytes(sequence), json));
        ops.add(DbOperation.put(TableEnum.META, EVENT_SEQ_KEY, ByteUtils.longToBytes(sequence)));
        return ops;
    }

    @Override
    public void publish(VotingEvent event) {
        publisher.publishEvent(event);
    }

    @Override
    public List<VotingEvent> list(long fromSequence, int limit) {
        List<VotingEvent> events = new ArrayList<>();
        for (DataBase.KeyValue kv : dataBase.rangeQueryWithLimit(TableEnum.EVENT,
                ByteUtils.longToBytes(Math.max(fromSequence, 1)), null, limit)) {
            try {
                events.add(objectMapper.readValue(kv.getValue(), VotingEvent.class));
            } catch (IOException e) {
                throw new IllegalStateException("事件反序列化失败, sequence=" + ByteUtils.bytesToLong(kv.getKey()), e);
            }
        }
        return events;
    }

    @Override
    public long count() {
        byte[] bytes = dataBase.get(TableEnum.META, EVENT_SEQ_KEY);
        return bytes == null ? 0 : ByteUtils.bytesToLong(bytes);
    }
}
