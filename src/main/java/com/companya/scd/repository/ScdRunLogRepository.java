package com.companya.scd.repository;

import com.companya.scd.model.domain.ScdRunLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ScdRunLogRepository extends JpaRepository<ScdRunLog, Long> {

    List<ScdRunLog> findTop20ByOrderByIdDesc();

    List<ScdRunLog> findTop20ByTableNameOrderByIdDesc(String tableName);

    /**
     * Latest committed pass for a table; used by operators to see how far history has advanced.
     */
    Optional<ScdRunLog> findFirstByTableNameAndStatusOrderByIdDesc(String tableName, String status);
}
