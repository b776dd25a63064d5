package com.troveindexer.query;

import com.troveindexer.domain.Position;
import com.troveindexer.domain.PositionRepository;
import com.troveindexer.domain.PositionStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read access to persisted positions for the API. Addresses are matched lowercased.
 */
@Service
@RequiredArgsConstructor
public class PositionQueryService {

    private final PositionRepository positionRepository;

    public Position getPosition(long positionId) {
        return positionRepository.findByPositionId(positionId)
                .orElseThrow(() -> new UnknownPositionException(positionId));
    }

    public List<Position> search(String walletAddress, String asset, PositionStatus status) {
        return positionRepository.search(normalize(walletAddress), normalize(asset), status);
    }

    private static String normalize(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        return address.strip().toLowerCase();
    }
}
