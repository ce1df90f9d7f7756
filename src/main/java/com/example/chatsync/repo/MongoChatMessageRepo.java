package com.example.chatsync.repo;

import com.example.chatsync.model.ChatMessage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Repository
public class MongoChatMessageRepo implements ChatMessageRepo {

    private static final Sort ASCENDING = Sort.by(Sort.Direction.ASC, "timestamp", "seq");
    private static final Sort DESCENDING = Sort.by(Sort.Direction.DESC, "timestamp", "seq");

    private final MongoTemplate mongo;

    @Autowired
    public MongoChatMessageRepo(MongoTemplate mongo) {
        this.mongo = mongo;
    }

    @Override
    public ChatMessage insert(ChatMessage message) {
        return mongo.insert(message);
    }

    @Override
    public Optional<ChatMessage> findById(String id) {
        return Optional.ofNullable(mongo.findById(id, ChatMessage.class));
    }

    @Override
    public Optional<ChatMessage> findLatest(String sessionId) {
        Query q = bySession(sessionId).with(DESCENDING).limit(1);
        return Optional.ofNullable(mongo.findOne(q, ChatMessage.class));
    }

    @Override
    public Optional<ChatMessage> findByClientId(String sessionId, String clientId) {
        Query q = new Query(Criteria.where("sessionId").is(sessionId).and("clientId").is(clientId));
        return Optional.ofNullable(mongo.findOne(q, ChatMessage.class));
    }

    @Override
    public List<ChatMessage> findPage(String sessionId, int offset, int limit) {
        Query q = bySession(sessionId).with(ASCENDING).skip(offset).limit(limit);
        return mongo.find(q, ChatMessage.class);
    }

    @Override
    public List<ChatMessage> findRecent(String sessionId, int limit) {
        Query q = bySession(sessionId).with(DESCENDING).limit(limit);
        List<ChatMessage> newestFirst = new ArrayList<>(mongo.find(q, ChatMessage.class));
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    @Override
    public List<ChatMessage> findAfter(String sessionId, long seq) {
        Query q = new Query(Criteria.where("sessionId").is(sessionId).and("seq").gt(seq)).with(ASCENDING);
        return mongo.find(q, ChatMessage.class);
    }

    @Override
    public long countBySessionId(String sessionId) {
        return mongo.count(bySession(sessionId), ChatMessage.class);
    }

    @Override
    public void deleteById(String id) {
        mongo.remove(new Query(Criteria.where("_id").is(id)), ChatMessage.class);
    }

    @Override
    public long deleteBySessionId(String sessionId) {
        return mongo.remove(bySession(sessionId), ChatMessage.class).getDeletedCount();
    }

    private static Query bySession(String sessionId) {
        return new Query(Criteria.where("sessionId").is(sessionId));
    }
}
