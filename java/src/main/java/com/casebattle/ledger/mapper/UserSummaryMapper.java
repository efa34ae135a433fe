package com.casebattle.ledger.mapper;

import com.casebattle.ledger.domain.UserSummary;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface UserSummaryMapper {

    void deleteAll();

    void insertAll(@Param("summaries") List<UserSummary> summaries);

    Optional<UserSummary> findByUserId(@Param("userId") long userId);

    List<UserSummary> findAll();
}
