package com.alertaggregator.mapper;

import com.alertaggregator.domain.model.Alert;
import com.alertaggregator.entity.AlertEntity;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the Alert domain model and AlertEntity.
 *
 * <p>Tags and metadata are collections in the domain model but JSON strings in the entity.
 * This mapper handles the JSON conversion via {@link JsonHelper}.
 */
@Mapper
public interface AlertMapper {

    @Mapping(source = "tags", target = "tags", qualifiedByName = "tagsToJson")
    @Mapping(source = "metadata", target = "metadata", qualifiedByName = "metadataToJson")
    @Mapping(target = "createdAt", ignore = true)
    AlertEntity toEntity(Alert alert);

    @Mapping(source = "tags", target = "tags", qualifiedByName = "jsonToTags")
    @Mapping(source = "metadata", target = "metadata", qualifiedByName = "jsonToMetadata")
    Alert toDomain(AlertEntity entity);

    List<Alert> toDomainList(List<AlertEntity> entities);

    @Named("tagsToJson")
    default String tagsToJson(List<String> tags) {
        return JsonHelper.toJson(tags != null ? tags : List.of());
    }

    @Named("jsonToTags")
    default List<String> jsonToTags(String json) {
        return new ArrayList<>(JsonHelper.fromJsonList(json, String.class));
    }

    @Named("metadataToJson")
    default String metadataToJson(Map<String, Object> metadata) {
        return JsonHelper.toJson(metadata != null ? metadata : Map.of());
    }

    @Named("jsonToMetadata")
    default Map<String, Object> jsonToMetadata(String json) {
        return JsonHelper.fromJsonMap(json);
    }
}
