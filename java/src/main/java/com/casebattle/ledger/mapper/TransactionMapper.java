package com.casebattle.ledger.mapper;

import com.casebattle.ledger.domain.LedgerTransaction;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface TransactionMapper {

    void insert(LedgerTransaction transaction);

    int deleteByUserId(@Param("userId") long userId);

    List<LedgerTransaction> findAll();

    List<LedgerTransaction> findRecentByUserId(@Param("userId") long userId,
                                               @Param("limit") int limit);
}
