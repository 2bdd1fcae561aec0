package com.packsync.mapper;

import com.packsync.domain.model.SeatPack;
import com.packsync.entity.SeatPackEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the SeatPack domain model and SeatPackEntity.
 *
 * <p>Seat keys and lineage ids are JSON columns. The legacy {@code synced_to_pos} flag is
 * translated through {@link PosSyncFlagAdapter} in both directions.
 */
@Mapper(imports = PosSyncFlagAdapter.class)
public interface SeatPackMapper {

    @Mapping(source = "seatKeys", target = "seatKeys", qualifiedByName = "listToJson")
    @Mapping(source = "sourcePackIds", target = "sourcePackIds", qualifiedByName = "listToJson")
    @Mapping(
            target = "syncedToPos",
            expression = "java(PosSyncFlagAdapter.legacyFlag(pack.getPackStatus(),"
                    + " pack.getPosStatus() != null && pack.getPosStatus().isListedAtVendor(),"
                    + " pack.isVendorCleanupOwed()))")
    @Mapping(target = "version", ignore = true)
    SeatPackEntity toEntity(SeatPack pack);

    @Mapping(source = "seatKeys", target = "seatKeys", qualifiedByName = "jsonToList")
    @Mapping(source = "sourcePackIds", target = "sourcePackIds", qualifiedByName = "jsonToList")
    @Mapping(target = "vendorCleanupOwed", expression = "java(PosSyncFlagAdapter.vendorCleanupOwed(entity))")
    SeatPack toDomain(SeatPackEntity entity);

    List<SeatPack> toDomainList(List<SeatPackEntity> entities);

    @Named("listToJson")
    default String listToJson(List<String> values) {
        return JsonHelper.stringListToJson(values);
    }

    @Named("jsonToList")
    default List<String> jsonToList(String json) {
        return JsonHelper.jsonToStringList(json);
    }
}
