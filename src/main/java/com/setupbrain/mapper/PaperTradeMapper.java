package com.setupbrain.mapper;

import com.setupbrain.domain.model.ClosedTrade;
import com.setupbrain.domain.model.OpenPosition;
import com.setupbrain.domain.model.PaperAccount;
import com.setupbrain.entity.ClosedTradeEntity;
import com.setupbrain.entity.OpenTradeEntity;
import com.setupbrain.entity.PaperAccountEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for the paper trading ledger: account, open position and closed trades.
 *
 * <p>Column names follow the ledger tables ({@code position_size}, {@code setup_id}),
 * so {@code size} and {@code decisionId} are renamed on the way in and out.
 */
@Mapper(componentModel = "spring")
public interface PaperTradeMapper {

    @Mapping(target = "id", ignore = true)
    PaperAccountEntity toEntity(PaperAccount paperAccount);

    PaperAccount toDomain(PaperAccountEntity entity);

    @Mapping(source = "size", target = "positionSize")
    @Mapping(source = "decisionId", target = "setupId")
    OpenTradeEntity toEntity(OpenPosition openPosition);

    @Mapping(source = "positionSize", target = "size")
    @Mapping(source = "setupId", target = "decisionId")
    OpenPosition toDomain(OpenTradeEntity entity);

    @Mapping(target = "id", ignore = true)
    @Mapping(source = "size", target = "positionSize")
    @Mapping(source = "decisionId", target = "setupId")
    ClosedTradeEntity toEntity(ClosedTrade closedTrade);

    @Mapping(source = "positionSize", target = "size")
    @Mapping(source = "setupId", target = "decisionId")
    ClosedTrade toDomain(ClosedTradeEntity entity);

    List<ClosedTrade> toClosedTradeList(List<ClosedTradeEntity> entities);
}
