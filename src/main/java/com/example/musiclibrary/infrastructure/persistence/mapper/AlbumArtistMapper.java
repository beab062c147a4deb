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
public interface AlbumArtistMapper {

    @Insert("<script>"
            + "INSERT INTO album_artist(album_id, artist_id, sort_order) VALUES "
            + "<foreach item='item' collection='links' separator=','>"
            + "(#{item.parentId}, #{item.artistId}, #{item.sortOrder})"
            + "</foreach>"
            + "</script>")
    int batchInsert(@Param("links") List<ArtistLinkEntity> links);

    @Select("SELECT id, album_id AS parent_id, artist_id, sort_order FROM album_artist "
            + "WHERE album_id = #{albumId} ORDER BY sort_order, id")
    List<ArtistLinkEntity> selectByAlbumId(@Param("albumId") Long albumId);

    @Select("SELECT a.name FROM album_artist l JOIN artist a ON a.id = l.artist_id "
            + "WHERE l.album_id = #{albumId} ORDER BY l.sort_order, l.id")
    List<String> selectOrderedArtistNames(@Param("albumId") Long albumId);

    @Update("UPDATE album_artist SET sort_order = #{sortOrder} WHERE id = #{id}")
    int updateSortOrder(@Param("id") Long id, @Param("sortOrder") int sortOrder);

    @Delete("DELETE FROM album_artist WHERE album_id = #{albumId} AND artist_id = #{artistId}")
    int deleteByAlbumAndArtist(@Param("albumId") Long albumId, @Param("artistId") Long artistId);

    @Delete("DELETE FROM album_artist WHERE album_id = #{albumId}")
    int deleteByAlbumId(@Param("albumId") Long albumId);

    @Delete("<script>"
            + "DELETE FROM album_artist WHERE album_id IN "
            + "<foreach item='id' collection='ids' open='(' separator=',' close=')'>#{id}</foreach>"
            + "</script>")
    int deleteByAlbumIds(@Param("ids") List<Long> ids);
}
