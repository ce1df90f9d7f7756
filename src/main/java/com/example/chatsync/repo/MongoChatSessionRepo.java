package com.example.chatsync.repo;

import com.example.chatsync.model.ChatSession;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class MongoChatSessionRepo implements ChatSessionRepo {

    private final MongoTemplate mongo;

    @Autowired
    public MongoChatSessionRepo(MongoTemplate mongo) {
        this.mongo = mongo;
    }

    @Override
    public Optional<ChatSession> findById(String sessionId) {
        return Optional.ofNullable(mongo.findById(sessionId, ChatSession.class));
    }

    @Override
    public ChatSession save(ChatSession session) {
        return mongo.save(session);
    }

    @Override
    public List<ChatSession> findActive(String userId, int offset, int limit) {
        Criteria criteria = Criteria.where("active").is(true);
        if (userId != null) {
            criteria = criteria.and("userId").is(userId);
        }
        Query q = new Query(criteria)
                .with(Sort.by(Sort.Direction.DESC, "activityAt"))
                .skip(offset)
                .limit(limit);
        return mongo.find(q, ChatSession.class);
    }
}
