package com.chicu.tradeads.repository;

import com.chicu.tradeads.domain.TradeAd;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TradeAdRepository extends JpaRepository<TradeAd, String> {

    List<TradeAd> findAllByOrderByNameAsc();
}
