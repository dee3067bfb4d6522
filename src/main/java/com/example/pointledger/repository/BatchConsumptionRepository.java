package com.example.pointledger.repository;

import com.example.pointledger.entity.BatchConsumption;
import com.example.pointledger.entity.ConsumptionReferenceType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * BatchConsumptionRepository
 *
 * 功能：寫入與查詢 FIFO 消費紀錄
 */
@Repository
public interface BatchConsumptionRepository extends JpaRepository<BatchConsumption, Long> {

    List<BatchConsumption> findByReferenceTypeAndReferenceIdOrderByIdAsc(
            ConsumptionReferenceType referenceType, String referenceId);
}
