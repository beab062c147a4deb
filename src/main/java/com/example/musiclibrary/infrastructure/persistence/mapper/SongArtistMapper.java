package com.example.musiclibrary.infrastructure.persistence.mapper;

import com.example.musiclibrary.infrastructure.persistence.entity.ArtistLinkEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface SongArtistMapper {

    @Insert("<script>"
            + "INSERT INTO song_artist(song_id, artist_id, sort_order) VALUES "
            + "<foreach item='item' collection='links' separator=','>"
            + "(#{item.parentId}, #{item.artistId}, #{item.sortOrder})"
            + "</foreach>"
            + "</script>")
    int batchInsert(@Param("links") List<ArtistLinkEntity> links);

    @Select("SELECT id, song_id AS parent_id, artist_id, sort_order FROM song_artist "
            + "WHERE song_id = #{songId} ORDER BY sort_order, id")
    List<ArtistLinkEntity> selectBySongId(@Param("songId") Long songId);

    @Select("SELECT a.name FROM song_artist l JOIN artist a ON a.id = l.artist_id "
            + "WHERE l.song_id = #{songId} ORDER BY l.sort_order, l.id")
    List<String> selectOrderedArtistNames(@Param("songId") Long songId);

    @Update("UPDATE song_artist SET sort_order = #{sortOrder} WHERE id = #{id}")
    int updateSortOrder(@Param("id") Long id, @Param("sortOrder") int sortOrder);

    @Delete("DELETE FROM song_artist WHERE song_id = #{songId} AND artist_id = #{artistId}")
    int deleteBySongAndArtist(@Param("songId") Long songId, @Param("artistId") Long artistId);

    @Delete("DELETE FROM song_artist WHERE song_id = #{songId}")
    int deleteBySongId(@Param("songId") Long songId);

    @Delete("<script>"
            + "DELETE FROM song_artist WHERE song_id IN "
            + "<foreach item='id' collection='ids' open='(' separator=',' close=')'>#{id}</foreach>"
            + "</script>")
    int deleteBySongIds(@Param("ids") List<Long> ids);
}
