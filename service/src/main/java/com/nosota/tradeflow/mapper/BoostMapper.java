package com.nosota.tradeflow.mapper;

import com.nosota.tradeflow.api.response.BoostPackageResponse;
import com.nosota.tradeflow.api.response.BoostPurchaseResponse;
import com.nosota.tradeflow.api.response.BoostedItemResponse;
import com.nosota.tradeflow.model.BoostPackage;
import com.nosota.tradeflow.model.BoostPurchase;
import com.nosota.tradeflow.model.BoostedItem;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface BoostMapper {

    BoostMapper INSTANCE = Mappers.getMapper(BoostMapper.class);

    BoostPackageResponse toResponse(BoostPackage boostPackage);

    List<BoostPackageResponse> toPackageResponseList(List<BoostPackage> packages);

    BoostPurchaseResponse toResponse(BoostPurchase purchase);

    BoostedItemResponse toResponse(BoostedItem boostedItem);

    List<BoostedItemResponse> toBoostedItemResponseList(List<BoostedItem> boostedItems);
}
