package org.gc.relaymonitor.repository;

import org.gc.relaymonitor.domain.ScheduleConfig;
import org.springframework.data.elasticsearch.repository.ElasticsearchRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ScheduleConfigRepository extends ElasticsearchRepository<ScheduleConfig, String> {

    Optional<ScheduleConfig> findFirstByOrderByCreatedAtAsc();
}
