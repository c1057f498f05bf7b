package com.flowb.social.repository.impl;

import com.flowb.social.model.Checkin;
import com.flowb.social.repository.CheckinRepository;
import com.flowb.social.store.DataStore;
import com.flowb.social.store.StoreQuery;
import com.flowb.social.util.QueryPerformanceTracker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class CheckinRepositoryImpl extends AbstractStoreRepository implements CheckinRepository {

    @Autowired
    public CheckinRepositoryImpl(DataStore dataStore, QueryPerformanceTracker queryTracker) {
        super(dataStore, queryTracker);
    }

    @Override
    public Checkin save(Checkin checkin) {
        return execute("Insert", Checkin.TABLE, "Failed to save check-in", () ->
            dataStore.insert(Checkin.TABLE, checkin, Checkin.class));
    }

    @Override
    public List<Checkin> findActiveForCrew(String crewId, Instant now) {
        return execute("Query", Checkin.TABLE, "Failed to load check-ins", () ->
            dataStore.query(StoreQuery.from(Checkin.TABLE)
                    .eq("crew_id", crewId)
                    .gt("expires_at", now)
                    .orderDesc("created_at"), Checkin.class));
    }
}
