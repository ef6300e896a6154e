package com.helia.mapper;

import com.helia.service.impl.entity.ChatMessageEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface ChatMessageMapper {

    int insert(ChatMessageEntity message);

    /** History joined with the owning session in one statement, ascending by sequence. */
    List<ChatMessageEntity> selectOwnedHistory(@Param("sessionId") String sessionId,
                                               @Param("ownerId") String ownerId);

    /** Newest first; callers reverse. */
    List<ChatMessageEntity> selectLatest(@Param("sessionId") String sessionId,
                                         @Param("limit") int limit);

    int deleteBySession(@Param("sessionId") String sessionId);
}
