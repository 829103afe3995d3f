package com.setupbrain.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.setupbrain.domain.model.DecisionRecord;
import com.setupbrain.entity.DecisionLogEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between DecisionRecord and DecisionLogEntity.
 *
 * <p>The dataContext map is stored as a JSON string; conversion goes through {@link JsonHelper}.
 */
@Mapper(componentModel = "spring")
public interface DecisionLogMapper {

    @Mapping(source = "dataContext", target = "dataContext", qualifiedByName = "mapToJson")
    DecisionLogEntity toEntity(DecisionRecord decisionRecord);

    @Mapping(source = "dataContext", target = "dataContext", qualifiedByName = "jsonToMap")
    DecisionRecord toDomain(DecisionLogEntity entity);

    List<DecisionRecord> toDomainList(List<DecisionLogEntity> entities);

    List<DecisionLogEntity> toEntityList(List<DecisionRecord> records);

    @Named("mapToJson")
    default String mapToJson(Map<String, Object> dataContext) {
        return JsonHelper.toJson(dataContext);
    }

    @Named("jsonToMap")
    default Map<String, Object> jsonToMap(String json) {
        return JsonHelper.fromJson(json, new TypeReference<Map<String, Object>>() {});
    }
}
