package org.gc.relaymonitor.repository;

import org.gc.relaymonitor.domain.Category;
import org.springframework.data.elasticsearch.repository.ElasticsearchRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CategoryRepository extends ElasticsearchRepository<Category, String> {

    List<Category> findAllByOrderByCreatedAtAsc();
}
