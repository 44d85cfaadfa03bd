package com.realtime.messaging.channel.repository;

import com.realtime.messaging.channel.entity.Channel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface ChannelRepository extends JpaRepository<Channel, String> {

    /** 공개 채널 + 내가 멤버/관리자인 비공개 채널 */
    @Query("""
           select distinct c
           from Channel c
             left join c.memberIds m
             left join c.adminIds a
           where c.active = true
             and (c.publicChannel = true or m = :userId or a = :userId)
           order by c.updatedAt desc
           """)
    List<Channel> findVisibleTo(@Param("userId") UUID userId);

    List<Channel> findByKindAndActiveTrueOrderByNameAsc(Channel.Kind kind);
}
