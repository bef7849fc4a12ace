package org.gc.relaymonitor.repository;

import org.gc.relaymonitor.domain.Site;
import org.springframework.data.elasticsearch.repository.ElasticsearchRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SiteRepository extends ElasticsearchRepository<Site, String> {

    List<Site> findByCategoryId(String categoryId);

    List<Site> findAllByOrderByCreatedAtAsc();
}
