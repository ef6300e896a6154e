package com.helia.mapper;

import com.helia.service.impl.entity.ChatSessionEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

@Mapper
public interface ChatSessionMapper {

    int insert(ChatSessionEntity session);

    ChatSessionEntity selectOwned(@Param("id") String id,
                                  @Param("ownerId") String ownerId);

    /** Same as {@link #selectOwned} but holds the row lock until the transaction ends. */
    ChatSessionEntity selectOwnedForUpdate(@Param("id") String id,
                                           @Param("ownerId") String ownerId);

    List<ChatSessionEntity> selectByOwner(@Param("ownerId") String ownerId,
                                          @Param("limit") int limit);

    int updateTitle(@Param("id") String id,
                    @Param("ownerId") String ownerId,
                    @Param("title") String title);

    /** Reserves the next sequence number; the row stays locked until commit. */
    int advanceSequence(@Param("id") String id,
                        @Param("updatedAt") Instant updatedAt);

    Long selectLastSequence(@Param("id") String id);

    int deleteById(@Param("id") String id);

    int countById(@Param("id") String id);
}
